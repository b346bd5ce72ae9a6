package com.questrail.facelink.audio;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EnvelopeExtractor
 * =============================================================================
 * Turns an audio clip into a sequence of mouth openness values.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   decode → mono PCM
 *     → RMS per non-overlapping window (partial trailing window ignored)
 *       → normalize by peak RMS
 *         → power curve
 *           → silence gate
 *             → exponential moving average, clamped
 *               → trim trailing quiet frames (+ tail)
 *                 → truncate to the scaled audio duration
 * </pre>
 *
 * <p>The extractor is stateless and thread-safe.</p>
 */
public final class EnvelopeExtractor
{
    private final PcmDecoder decoder;
    private final EnvelopeConfig config;

    public EnvelopeExtractor(PcmDecoder decoder, EnvelopeConfig config) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.config = Objects.requireNonNull(config, "config");
    }

    public EnvelopeExtractor() {
        this(new JavaSoundPcmDecoder(), EnvelopeConfig.defaults());
    }

    public EnvelopeConfig config() {
        return config;
    }

    /**
     * @throws AudioDecodeException if {@code encoded} cannot be decoded
     */
    public Envelope extract(byte[] encoded) {
        return extract(decoder.decode(encoded));
    }

    public Envelope extract(PcmAudio audio) {
        Objects.requireNonNull(audio, "audio");

        int window = (int) (audio.sampleRate() * config.frameMillis() / 1000.0);
        if (audio.length() == 0 || window <= 0) {
            return Envelope.empty(audio.duration(), config.frameDuration());
        }

        double[] values = windowRms(audio.samples(), window);
        normalize(values);
        shape(values);
        smooth(values);

        int kept = trimmedLength(values);
        int target = (int) Math.floor(audio.durationSeconds() * config.durationScale() * 1000.0 / config.frameMillis());
        if (kept > target && target > 0) {
            kept = target;
        }

        List<Double> frames = new ArrayList<>(kept);
        for (int i = 0; i < kept; i++) {
            frames.add(values[i]);
        }
        return new Envelope(frames, audio.duration(), config.frameDuration());
    }

    private static double[] windowRms(float[] samples, int window) {
        int count = samples.length / window;
        double[] rms = new double[count];
        for (int w = 0; w < count; w++) {
            double sumSquares = 0.0;
            int offset = w * window;
            for (int i = 0; i < window; i++) {
                double s = samples[offset + i];
                sumSquares += s * s;
            }
            rms[w] = Math.sqrt(sumSquares / window);
        }
        return rms;
    }

    private static void normalize(double[] values) {
        double peak = 0.0;
        for (double v : values) {
            peak = Math.max(peak, v);
        }
        if (peak > 0.0) {
            for (int i = 0; i < values.length; i++) {
                values[i] /= peak;
            }
        }
    }

    private void shape(double[] values) {
        for (int i = 0; i < values.length; i++) {
            double v = Math.pow(values[i], config.powerCurve());
            values[i] = v > config.silenceThreshold() ? v : 0.0;
        }
    }

    private void smooth(double[] values) {
        double alpha = config.smoothingAlpha();
        double previous = 0.0;
        for (int i = 0; i < values.length; i++) {
            double s = alpha * previous + (1.0 - alpha) * values[i];
            previous = s;
            values[i] = Math.max(config.minOpen(), Math.min(config.maxOpen(), s));
        }
    }

    private int trimmedLength(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        int last = values.length - 1;
        while (last > 0 && values[last] < config.trimThreshold()) {
            last--;
        }
        return Math.min(last + 1 + config.tailFrames(), values.length);
    }
}
