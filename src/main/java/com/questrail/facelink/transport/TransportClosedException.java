package com.questrail.facelink.transport;

/**
 * The remote end closed the stream. Distinct from "no data available yet".
 */
public final class TransportClosedException extends TransportException
{
    public TransportClosedException(String message) {
        super(message);
    }

    public TransportClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
