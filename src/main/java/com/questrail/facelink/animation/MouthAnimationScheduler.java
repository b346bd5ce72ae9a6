package com.questrail.facelink.animation;

import com.questrail.facelink.api.FireAndForgetChannel;
import com.questrail.facelink.audio.Envelope;
import com.questrail.facelink.internal.time.MonotonicClock;
import com.questrail.facelink.internal.time.MonotonicScheduler;
import com.questrail.facelink.internal.time.Sleeper;
import com.questrail.facelink.internal.time.SystemMonotonicClock;
import com.questrail.facelink.internal.time.SystemSleeper;
import com.questrail.facelink.internal.time.SystemWallClock;
import com.questrail.facelink.internal.time.WallClock;
import com.questrail.facelink.observability.AnimationEvent;
import com.questrail.facelink.observability.LinkErrorEvent;
import com.questrail.facelink.observability.LinkObservabilitySink;
import com.questrail.facelink.observability.NullObservabilitySink;
import com.questrail.facelink.protocol.model.DeviceCommand;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * MouthAnimationScheduler
 * =============================================================================
 * Plays an {@link Envelope} as a stream of {@code mouth} commands on a
 * {@link FireAndForgetChannel}.
 *
 * <h2>Timing</h2>
 * The start time is taken once. Frame {@code i} is sent first, then the run
 * sleeps until {@code start + (i + 1) × frame}. Send latency is absorbed by the
 * sleep and the schedule does not drift.
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>The cancel flag and the thread's interrupt status are checked once per frame.</li>
 *   <li>Whatever the exit path, exactly one closing frame ({@code open = 0}) is sent.</li>
 *   <li>A failed send is reported as {@link AnimationEvent.FrameDropped} and the run continues.</li>
 * </ul>
 *
 * <p>The scheduler never reads from the link and never takes its command token,
 * so it can run alongside a blocking command on another thread.</p>
 */
public final class MouthAnimationScheduler
{
    /** Frame index reported for a failed closing frame. */
    public static final int CLOSING_FRAME = -1;

    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final LinkObservabilitySink observabilitySink;

    public MouthAnimationScheduler(LinkObservabilitySink observabilitySink) {
        this(SystemMonotonicClock.INSTANCE, SystemSleeper.INSTANCE, SystemWallClock.INSTANCE, observabilitySink);
    }

    public MouthAnimationScheduler(MonotonicClock clock,
                                   Sleeper sleeper,
                                   WallClock wallClock,
                                   LinkObservabilitySink observabilitySink) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Play {@code envelope} on the calling thread.
     */
    public AnimationResult run(Envelope envelope, FireAndForgetChannel channel, BooleanSupplier cancelled) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(cancelled, "cancelled");

        int planned = envelope.size();
        long frameNanos = envelope.frameDuration().toNanos();
        long start = clock.nowNanos();

        observabilitySink.onAnimationEvent(
                new AnimationEvent.Started(wallClock.now(), planned, envelope.frameDuration()));

        int sent = 0;
        int dropped = 0;
        boolean stopped = false;

        for (int i = 0; i < planned; i++) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                stopped = true;
                break;
            }

            if (send(channel, envelope.frame(i), i)) {
                sent++;
            } else {
                dropped++;
            }

            long wake = start + (i + 1) * frameNanos;
            try {
                sleeper.sleepNanos(wake - clock.nowNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopped = true;
                break;
            }
        }

        send(channel, 0.0, CLOSING_FRAME);

        AnimationResult result = new AnimationResult(
                planned, sent, dropped, stopped, Duration.ofNanos(clock.nowNanos() - start));
        observabilitySink.onAnimationEvent(new AnimationEvent.Finished(wallClock.now(), result));
        return result;
    }

    /**
     * Play {@code envelope} on {@code executor}.
     */
    public AnimationHandle start(Envelope envelope, FireAndForgetChannel channel, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        AnimationHandle handle = new AnimationHandle();
        executor.execute(task(handle, envelope, channel));
        return handle;
    }

    /**
     * Play {@code envelope} once {@code delay} has elapsed on this scheduler's clock.
     */
    public AnimationHandle startAfter(Duration delay,
                                      Envelope envelope,
                                      FireAndForgetChannel channel,
                                      MonotonicScheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        AnimationHandle handle = new AnimationHandle();
        scheduler.scheduleAfter(delay, clock, task(handle, envelope, channel));
        return handle;
    }

    private Runnable task(AnimationHandle handle, Envelope envelope, FireAndForgetChannel channel) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(channel, "channel");
        return () -> {
            try {
                handle.complete(run(envelope, channel, handle::cancelled));
            } catch (RuntimeException e) {
                observabilitySink.onError(new LinkErrorEvent(wallClock.now(), "Animation run failed", e));
                handle.fail(e);
            }
        };
    }

    private boolean send(FireAndForgetChannel channel, double open, int index) {
        try {
            channel.send(DeviceCommand.mouth(open));
            return true;
        } catch (RuntimeException e) {
            observabilitySink.onAnimationEvent(new AnimationEvent.FrameDropped(wallClock.now(), index, e));
            return false;
        }
    }
}
