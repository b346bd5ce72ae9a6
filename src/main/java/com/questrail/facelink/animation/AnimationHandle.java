package com.questrail.facelink.animation;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AnimationHandle
 * =============================================================================
 * Control of one background animation run.
 *
 * <p>{@link #cancel()} only raises a flag. The run notices it at its next frame
 * boundary, sends the closing frame and completes {@link #result()}; a run
 * cancelled before it started still executes, exits at once, and sends just
 * the closing frame. The result future therefore always completes.</p>
 */
public final class AnimationHandle
{
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<AnimationResult> result = new CompletableFuture<>();

    AnimationHandle() {}

    /**
     * Request the run to stop. Idempotent.
     *
     * @return {@code true} if this call raised the flag
     */
    public boolean cancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<AnimationResult> result() {
        return result;
    }

    /**
     * Wait up to {@code timeout} for the run to finish.
     *
     * @return the result, or empty if the run has not finished in time
     * @throws InterruptedException if the caller is interrupted while waiting
     * @throws IllegalStateException if the run failed
     */
    public Optional<AnimationResult> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(result.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Animation run failed", e.getCause());
        }
    }

    boolean cancelled() {
        return cancelRequested.get();
    }

    void complete(AnimationResult r) {
        result.complete(r);
    }

    void fail(Throwable t) {
        result.completeExceptionally(t);
    }
}
