package com.questrail.facelink.observability;

/**
 * No-op implementation of LinkObservabilitySink.
 */
public final class NullObservabilitySink implements LinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(LinkTransportEvent event) {}

    @Override
    public void onProtocolEvent(LinkProtocolEvent event) {}

    @Override
    public void onAnimationEvent(AnimationEvent event) {}

    @Override
    public void onError(LinkErrorEvent event) {}
}
