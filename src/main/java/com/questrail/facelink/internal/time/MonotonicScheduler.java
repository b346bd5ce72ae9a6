package com.questrail.facelink.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution keyed on monotonic deadlines.
 *
 * <p>The mouth sync orchestrator uses it to start an animation run a fixed
 * buffering delay after the remote playback was triggered, without blocking the
 * caller for that delay.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos} on the given clock's scale.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.deadlineAfter(delay), task);
    }
}
