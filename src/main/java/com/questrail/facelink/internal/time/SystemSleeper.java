package com.questrail.facelink.internal.time;

import java.util.concurrent.TimeUnit;

/**
 * {@link Sleeper} backed by {@link Thread#sleep}.
 */
public enum SystemSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleepNanos(long nanos) throws InterruptedException {
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    }
}
