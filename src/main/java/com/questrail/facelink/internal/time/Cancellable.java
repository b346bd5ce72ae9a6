package com.questrail.facelink.internal.time;

/**
 * Cancellation handle for work handed to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task had not started and will now never run;
     *         {@code false} if it already ran, is running, or was cancelled before.
     */
    boolean cancel();
}
