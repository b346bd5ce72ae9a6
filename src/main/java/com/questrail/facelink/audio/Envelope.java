package com.questrail.facelink.audio;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Loudness envelope of one clip: one mouth openness in {@code [0.0, 1.0]} per
 * frame, plus the measured length of the audio it came from.
 */
public record Envelope(List<Double> frames, Duration audioDuration, Duration frameDuration)
{
    public Envelope {
        frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
        Objects.requireNonNull(audioDuration, "audioDuration");
        Objects.requireNonNull(frameDuration, "frameDuration");
        if (frameDuration.isZero() || frameDuration.isNegative()) {
            throw new IllegalArgumentException("frameDuration must be > 0");
        }
    }

    public static Envelope empty(Duration audioDuration, Duration frameDuration) {
        return new Envelope(List.of(), audioDuration, frameDuration);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public double frame(int index) {
        return frames.get(index);
    }

    /** Time the animation of this envelope takes: frames × frame duration. */
    public Duration animationDuration() {
        return frameDuration.multipliedBy(frames.size());
    }
}
