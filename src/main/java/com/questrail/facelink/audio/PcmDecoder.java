package com.questrail.facelink.audio;

/**
 * Decodes an encoded audio clip (MP3, WAV, ...) into mono PCM.
 */
@FunctionalInterface
public interface PcmDecoder
{
    /**
     * @throws AudioDecodeException if the buffer is not a decodable audio stream
     */
    PcmAudio decode(byte[] encoded);
}
