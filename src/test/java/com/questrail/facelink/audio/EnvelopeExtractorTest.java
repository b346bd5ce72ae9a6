package com.questrail.facelink.audio;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeExtractorTest {

    private static final float RATE = 8000f;

    private static float[] tone(int samples, double amplitude, double hz) {
        float[] out = new float[samples];
        for (int i = 0; i < samples; i++) {
            out[i] = (float) (amplitude * Math.sin(2 * Math.PI * hz * i / RATE));
        }
        return out;
    }

    private static float[] concat(float[] a, float[] b) {
        float[] out = new float[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static EnvelopeExtractor extractor(EnvelopeConfig config) {
        return new EnvelopeExtractor(bytes -> { throw new AssertionError("not used"); }, config);
    }

    @Test
    void silentClipIsTrimmedToAFewClosedFrames() {
        Envelope env = extractor(EnvelopeConfig.defaults()).extract(new PcmAudio(new float[8000], RATE));

        assertEquals(4, env.size(), "first frame plus three tail frames");
        assertTrue(env.frames().stream().allMatch(v -> v == 0.0));
        assertEquals(Duration.ofSeconds(1), env.audioDuration());
    }

    @Test
    void constantToneRampsTowardsFullyOpen() {
        // 400 Hz at 8 kHz: exactly 12 periods per 240-sample window, so every window has the same RMS.
        Envelope env = extractor(EnvelopeConfig.defaults()).extract(new PcmAudio(tone(8000, 0.5, 400), RATE));

        assertEquals(0.65, env.frame(0), 1e-3);
        assertEquals(0.8775, env.frame(1), 1e-3);
        for (int i = 1; i < env.size(); i++) {
            assertTrue(env.frame(i) >= env.frame(i - 1) - 1e-6, "non-decreasing at " + i);
        }
        assertEquals(1.0, env.frame(env.size() - 1), 1e-3);
    }

    @Test
    void envelopeIsTruncatedToScaledDuration() {
        // 1 s of audio: 33 windows, target floor(1.0 * 0.7 * 1000 / 30) = 23
        Envelope env = extractor(EnvelopeConfig.defaults()).extract(new PcmAudio(tone(8000, 0.5, 400), RATE));

        assertEquals(23, env.size());
        assertEquals(Duration.ofMillis(690), env.animationDuration());
    }

    @Test
    void trailingQuietIsTrimmedWithTail() {
        EnvelopeConfig noScale = EnvelopeConfig.builder().durationScale(1.0).build();
        float[] audio = concat(tone(4000, 0.8, 400), tone(4000, 0.0001, 400));

        Envelope env = extractor(noScale).extract(new PcmAudio(audio, RATE));

        assertTrue(env.size() < 33, "quiet tail was trimmed");
        assertTrue(env.frame(env.size() - 4) >= 0.01, "last audible frame is kept");
        for (int i = env.size() - 3; i < env.size(); i++) {
            assertTrue(env.frame(i) < 0.01, "tail frame " + i);
        }
    }

    @Test
    void quietPassagesAreGatedToZeroBeforeSmoothing() {
        EnvelopeConfig noSmoothing = EnvelopeConfig.builder().smoothingAlpha(0.0).durationScale(1.0).build();
        float[] audio = concat(concat(tone(2400, 1.0, 400), tone(2400, 0.0001, 400)), tone(2400, 1.0, 400));

        Envelope env = extractor(noSmoothing).extract(new PcmAudio(audio, RATE));

        assertEquals(1.0, env.frame(0), 1e-6);
        assertEquals(0.0, env.frame(12), 0.0);
        assertEquals(1.0, env.frame(25), 1e-6);
    }

    @Test
    void valuesStayWithinOpenRange() {
        Random rnd = new Random(42);
        float[] noise = new float[16000];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = (float) (rnd.nextGaussian() * (i % 3000) / 3000.0);
        }
        EnvelopeConfig capped = EnvelopeConfig.builder().openRange(0.1, 0.8).build();

        Envelope env = extractor(capped).extract(new PcmAudio(noise, RATE));

        assertFalse(env.isEmpty());
        assertTrue(env.frames().stream().allMatch(v -> v >= 0.1 && v <= 0.8));
    }

    @Test
    void partialTrailingWindowIsIgnored() {
        EnvelopeConfig noTrim = EnvelopeConfig.builder().durationScale(10.0).build();

        Envelope env = extractor(noTrim).extract(new PcmAudio(tone(250, 0.5, 400), RATE));

        assertEquals(1, env.size());
    }

    @Test
    void emptyAudioYieldsEmptyEnvelope() {
        assertTrue(extractor(EnvelopeConfig.defaults()).extract(new PcmAudio(new float[0], RATE)).isEmpty());
    }

    @Test
    void windowOfZeroSamplesYieldsEmptyEnvelope() {
        Envelope env = extractor(EnvelopeConfig.defaults()).extract(new PcmAudio(new float[100], 10f));

        assertTrue(env.isEmpty());
        assertEquals(Duration.ofSeconds(10), env.audioDuration());
    }

    @Test
    void undecodableBytesRaiseAudioDecodeException() {
        EnvelopeExtractor real = new EnvelopeExtractor();

        assertThrows(AudioDecodeException.class, () -> real.extract(new byte[] {1, 2, 3, 4, 5}));
    }

    @Test
    void configRejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().smoothingAlpha(1.0).build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().frameDuration(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().openRange(0.9, 0.1).build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().tailFrames(-1).build());
    }

    @Test
    void configRejectsNonFiniteTuning() {
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().smoothingAlpha(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().silenceThreshold(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeConfig.builder().trimThreshold(Double.NaN).build());
        assertThrows(IllegalArgumentException.class,
            () -> EnvelopeConfig.builder().trimThreshold(Double.POSITIVE_INFINITY).build());
        assertThrows(IllegalArgumentException.class,
            () -> EnvelopeConfig.builder().durationScale(Double.POSITIVE_INFINITY).build());
    }
}
