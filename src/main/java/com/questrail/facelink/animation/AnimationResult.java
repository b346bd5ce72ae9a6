package com.questrail.facelink.animation;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one animation run.
 *
 * <p>{@code framesSent} and {@code framesDropped} count envelope frames only;
 * the closing frame is not included. A cancelled run has
 * {@code framesSent + framesDropped < framesPlanned}.</p>
 */
public record AnimationResult(
        int framesPlanned,
        int framesSent,
        int framesDropped,
        boolean cancelled,
        Duration elapsed
) {
    public AnimationResult {
        Objects.requireNonNull(elapsed, "elapsed");
        if (framesPlanned < 0 || framesSent < 0 || framesDropped < 0) {
            throw new IllegalArgumentException("frame counts must be >= 0");
        }
        if (framesSent + framesDropped > framesPlanned) {
            throw new IllegalArgumentException("more frames attempted than planned");
        }
    }
}
