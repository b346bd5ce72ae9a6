package com.questrail.facelink.internal.time;

/**
 * Sleeper
 * =============================================================================
 * Blocking pause, separated from {@link MonotonicClock} so that tests can
 * replace real sleeping with advancing a manual clock.
 *
 * <p>Callers compute how long to sleep from an absolute deadline on the clock,
 * never by accumulating durations, so an imprecise sleeper adds jitter but no
 * drift.</p>
 */
public interface Sleeper
{
    /**
     * Pause the calling thread for about {@code nanos}. Non-positive values return at once.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleepNanos(long nanos) throws InterruptedException;
}
