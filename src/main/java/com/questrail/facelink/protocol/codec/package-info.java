/**
 * Line-level codec for the device link.
 * =============================================================================
 *
 * <p>Two pieces sit between the raw transport and the session:</p>
 * <ul>
 *   <li>{@link com.questrail.facelink.protocol.codec.LineFramer}: bytes to lines,
 *       with carry-over of partial lines</li>
 *   <li>{@link com.questrail.facelink.protocol.codec.JsonLineCodec}: lines to
 *       {@link com.questrail.facelink.protocol.model.LinkMessage} variants, and
 *       commands to lines</li>
 * </ul>
 *
 * <p>Neither piece performs I/O, waits, or keeps protocol state beyond the
 * framer's carry buffer.</p>
 */
package com.questrail.facelink.protocol.codec;
