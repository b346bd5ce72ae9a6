package com.questrail.facelink.audio;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded mono audio: samples in {@code [-1.0, 1.0]} at the clip's native rate.
 *
 * <p>The sample array is copied on the way in and on the way out.</p>
 */
public record PcmAudio(float[] samples, float sampleRate)
{
    public PcmAudio {
        samples = Objects.requireNonNull(samples, "samples").clone();
        if (!(sampleRate > 0)) {
            throw new IllegalArgumentException("sampleRate must be > 0");
        }
    }

    @Override
    public float[] samples() {
        return samples.clone();
    }

    public int length() {
        return samples.length;
    }

    public double durationSeconds() {
        return samples.length / (double) sampleRate;
    }

    public Duration duration() {
        return Duration.ofNanos(Math.round(durationSeconds() * 1_000_000_000L));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PcmAudio other)) return false;
        return Float.compare(sampleRate, other.sampleRate) == 0 && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(samples) + Float.hashCode(sampleRate);
    }

    @Override
    public String toString() {
        return "PcmAudio[samples=" + samples.length + ", sampleRate=" + sampleRate + "]";
    }
}
