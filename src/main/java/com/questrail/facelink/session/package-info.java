/**
 * The link session: command/response matching, event queueing and the image
 * handshake, on top of any {@link com.questrail.facelink.transport.ByteTransport}.
 */
package com.questrail.facelink.session;
