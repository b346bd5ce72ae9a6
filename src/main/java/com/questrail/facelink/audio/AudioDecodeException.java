package com.questrail.facelink.audio;

/**
 * Thrown when an audio buffer cannot be decoded to PCM.
 */
public class AudioDecodeException extends RuntimeException
{
    public AudioDecodeException(String message) {
        super(message);
    }

    public AudioDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
