package com.questrail.facelink.transport;

/**
 * Indicates that the byte stream to the device failed.
 *
 * This covers:
 * <ul>
 *   <li>failure to open a serial port or connect a socket</li>
 *   <li>write failures</li>
 *   <li>read failures</li>
 * </ul>
 *
 * Transport failures are fatal to the session and are never retried by the link layer.
 */
public class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
