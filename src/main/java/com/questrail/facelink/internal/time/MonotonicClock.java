package com.questrail.facelink.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every deadline in the link: response waits, boot drains, and
 * the animation frame schedule.
 *
 * <p>Wall-clock time ({@code Instant.now()}) may step under NTP and is used
 * only to stamp observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick in nanoseconds. Only differences are meaningful.
     */
    long nowNanos();

    /**
     * Absolute deadline {@code timeout} from now, in this clock's ticks.
     */
    default long deadlineAfter(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        return nowNanos() + timeout.toNanos();
    }
}
