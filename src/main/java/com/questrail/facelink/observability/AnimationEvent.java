package com.questrail.facelink.observability;

import com.questrail.facelink.animation.AnimationResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Progress of a mouth animation run.
 */
public sealed interface AnimationEvent
        permits AnimationEvent.Started, AnimationEvent.FrameDropped, AnimationEvent.Finished
{
    Instant timestamp();

    record Started(Instant timestamp, int frames, Duration frameDuration) implements AnimationEvent {}

    /** A single fire-and-forget send failed; the run continued. */
    record FrameDropped(Instant timestamp, int frameIndex, Throwable cause) implements AnimationEvent {}

    record Finished(Instant timestamp, AnimationResult result) implements AnimationEvent {}
}
