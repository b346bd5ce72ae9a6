package com.questrail.facelink.audio;

import java.time.Duration;
import java.util.Objects;

/**
 * EnvelopeConfig
 * -----------------------------------------------------------------------------
 * Tuning for {@link EnvelopeExtractor}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>frameDuration</b>: length of one analysis window and one animation frame.</li>
 *   <li><b>smoothingAlpha</b>: weight of the previous value in the moving average.</li>
 *   <li><b>powerCurve</b>: exponent applied after normalization; below 1 lifts quiet speech.</li>
 *   <li><b>silenceThreshold</b>: values not above it become 0 before smoothing.</li>
 *   <li><b>trimThreshold</b>: trailing frames below it are cut.</li>
 *   <li><b>tailFrames</b>: frames kept after the last audible one.</li>
 *   <li><b>durationScale</b>: fraction of the measured audio length the animation may last.
 *       The device's playback runs ahead of the decoded length; 0.7 was tuned on one unit.</li>
 *   <li><b>minOpen</b>, <b>maxOpen</b>: clamp range of the smoothed value.</li>
 * </ul>
 */
public record EnvelopeConfig(
        Duration frameDuration,
        double smoothingAlpha,
        double powerCurve,
        double silenceThreshold,
        double trimThreshold,
        int tailFrames,
        double durationScale,
        double minOpen,
        double maxOpen
) {
    public EnvelopeConfig {
        Objects.requireNonNull(frameDuration, "frameDuration");
        if (frameDuration.isZero() || frameDuration.isNegative()) {
            throw new IllegalArgumentException("frameDuration must be > 0");
        }
        if (!Double.isFinite(smoothingAlpha) || !Double.isFinite(powerCurve)
                || !Double.isFinite(silenceThreshold) || !Double.isFinite(trimThreshold)
                || !Double.isFinite(durationScale) || !Double.isFinite(minOpen) || !Double.isFinite(maxOpen)) {
            throw new IllegalArgumentException("tuning values must be finite");
        }
        if (smoothingAlpha < 0.0 || smoothingAlpha >= 1.0) {
            throw new IllegalArgumentException("smoothingAlpha must be in [0, 1)");
        }
        if (!(powerCurve > 0.0)) {
            throw new IllegalArgumentException("powerCurve must be > 0");
        }
        if (silenceThreshold < 0.0 || trimThreshold < 0.0) {
            throw new IllegalArgumentException("thresholds must be >= 0");
        }
        if (tailFrames < 0) {
            throw new IllegalArgumentException("tailFrames must be >= 0");
        }
        if (!(durationScale > 0.0)) {
            throw new IllegalArgumentException("durationScale must be > 0");
        }
        if (minOpen < 0.0 || maxOpen > 1.0 || minOpen > maxOpen) {
            throw new IllegalArgumentException("require 0 <= minOpen <= maxOpen <= 1");
        }
    }

    public static EnvelopeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Frame duration in (possibly fractional) milliseconds. */
    public double frameMillis() {
        return frameDuration.toNanos() / 1_000_000.0;
    }

    public static final class Builder {
        private Duration frameDuration = Duration.ofMillis(30);
        private double smoothingAlpha = 0.35;
        private double powerCurve = 0.6;
        private double silenceThreshold = 0.02;
        private double trimThreshold = 0.01;
        private int tailFrames = 3;
        private double durationScale = 0.7;
        private double minOpen = 0.0;
        private double maxOpen = 1.0;

        private Builder() {}

        public Builder frameDuration(Duration d) {
            this.frameDuration = d;
            return this;
        }

        public Builder smoothingAlpha(double v) {
            this.smoothingAlpha = v;
            return this;
        }

        public Builder powerCurve(double v) {
            this.powerCurve = v;
            return this;
        }

        public Builder silenceThreshold(double v) {
            this.silenceThreshold = v;
            return this;
        }

        public Builder trimThreshold(double v) {
            this.trimThreshold = v;
            return this;
        }

        public Builder tailFrames(int n) {
            this.tailFrames = n;
            return this;
        }

        public Builder durationScale(double v) {
            this.durationScale = v;
            return this;
        }

        public Builder openRange(double min, double max) {
            this.minOpen = min;
            this.maxOpen = max;
            return this;
        }

        public EnvelopeConfig build() {
            return new EnvelopeConfig(
                    frameDuration,
                    smoothingAlpha,
                    powerCurve,
                    silenceThreshold,
                    trimThreshold,
                    tailFrames,
                    durationScale,
                    minOpen,
                    maxOpen
            );
        }
    }
}
