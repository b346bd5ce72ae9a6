/**
 * Byte transports to the device. Serial and TCP implementations live in sub-packages.
 */
package com.questrail.facelink.transport;
