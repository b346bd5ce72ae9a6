package com.questrail.facelink.audio;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * JavaSoundPcmDecoder
 * =============================================================================
 * {@link PcmDecoder} on {@code javax.sound.sampled}.
 *
 * <p>Any format an installed service provider can read is accepted. MP3 needs
 * the {@code mp3spi} provider on the runtime classpath; WAV and AIFF are
 * handled by the JDK itself.</p>
 *
 * <p>The stream is converted to 16-bit signed little-endian PCM at its native
 * sample rate and channel count, then the channels are averaged into one.</p>
 */
public final class JavaSoundPcmDecoder implements PcmDecoder
{
    private static final int BYTES_PER_SAMPLE = 2;

    @Override
    public PcmAudio decode(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");

        try (AudioInputStream source = AudioSystem.getAudioInputStream(
                new BufferedInputStream(new ByteArrayInputStream(encoded)))) {

            AudioFormat base = source.getFormat();
            int channels = Math.max(1, base.getChannels());
            float rate = base.getSampleRate();
            if (!(rate > 0)) {
                throw new AudioDecodeException("Unknown sample rate in " + base);
            }

            AudioFormat pcm = new AudioFormat(
                    AudioFormat.Encoding.PCM_SIGNED,
                    rate,
                    16,
                    channels,
                    channels * BYTES_PER_SAMPLE,
                    rate,
                    false);

            try (AudioInputStream decoded = AudioSystem.getAudioInputStream(pcm, source)) {
                return new PcmAudio(downmix(decoded.readAllBytes(), channels), rate);
            }
        } catch (AudioDecodeException e) {
            throw e;
        } catch (UnsupportedAudioFileException | IOException | RuntimeException e) {
            // Third-party providers fail on corrupt streams with arbitrary runtime exceptions.
            throw new AudioDecodeException("Cannot decode audio (" + encoded.length + " bytes)", e);
        }
    }

    static float[] downmix(byte[] raw, int channels) {
        int frameSize = channels * BYTES_PER_SAMPLE;
        int frames = raw.length / frameSize;
        float[] mono = new float[frames];

        for (int f = 0; f < frames; f++) {
            int base = f * frameSize;
            float sum = 0f;
            for (int c = 0; c < channels; c++) {
                int i = base + c * BYTES_PER_SAMPLE;
                short s = (short) ((raw[i + 1] << 8) | (raw[i] & 0xFF));
                sum += s / 32768f;
            }
            mono[f] = sum / channels;
        }
        return mono;
    }
}
