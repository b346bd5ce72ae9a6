package com.questrail.facelink.observability;

/**
 * Receives observability events from the link, the animation scheduler and the
 * mouth sync orchestrator. Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from the caller's thread, the animation thread or a
 * Netty event loop; implementations must be thread-safe and must not block.</p>
 */
public interface LinkObservabilitySink {
    /**
     * Called when a transport opens or closes.
     * @param event the transport event
     */
    void onTransportEvent(LinkTransportEvent event);

    /**
     * Called for non-fatal protocol occurrences (timeouts, dropped lines, rejections).
     * @param event the protocol event
     */
    void onProtocolEvent(LinkProtocolEvent event);

    /**
     * Called as a mouth animation starts, drops a frame, and finishes.
     * @param event the animation event
     */
    void onAnimationEvent(AnimationEvent event);

    /**
     * Called when an error occurs that the caller does not see directly.
     * @param event the error event
     */
    void onError(LinkErrorEvent event);
}
