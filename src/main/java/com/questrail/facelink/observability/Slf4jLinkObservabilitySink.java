package com.questrail.facelink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 *
 * <p>Malformed lines are logged at debug: the device's boot log produces many of
 * them and they are expected.</p>
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    @Override
    public void onTransportEvent(LinkTransportEvent event) {
        if (event instanceof LinkTransportEvent.Opened opened) {
            log.info("Link opened: {}", opened.endpoint());
        } else if (event instanceof LinkTransportEvent.Closed closed) {
            if (closed.cause() == null) {
                log.info("Link closed: {}", closed.endpoint());
            } else {
                log.warn("Link closed: {} ({})", closed.endpoint(), closed.cause().toString());
            }
        }
    }

    @Override
    public void onProtocolEvent(LinkProtocolEvent event) {
        if (event instanceof LinkProtocolEvent.ResponseTimeout timeout) {
            log.warn("No response to {} within {} ms", timeout.command(), timeout.timeout().toMillis());
        } else if (event instanceof LinkProtocolEvent.ImageRejected rejected) {
            log.info("Image of {} bytes rejected: {}", rejected.length(), rejected.response());
        } else if (event instanceof LinkProtocolEvent.EventDropped dropped) {
            log.warn("Event queue full, dropped {}", dropped.event());
        } else {
            log.debug("Link protocol event: {}", event);
        }
    }

    @Override
    public void onAnimationEvent(AnimationEvent event) {
        if (event instanceof AnimationEvent.Started started) {
            log.info("Animating {} frames over {} ms",
                started.frames(),
                started.frames() * started.frameDuration().toMillis());
        } else if (event instanceof AnimationEvent.Finished finished) {
            log.info("Animation {} ({} ms actual, {} of {} frames sent, {} dropped)",
                finished.result().cancelled() ? "cancelled" : "complete",
                finished.result().elapsed().toMillis(),
                finished.result().framesSent(),
                finished.result().framesPlanned(),
                finished.result().framesDropped());
        } else if (event instanceof AnimationEvent.FrameDropped dropped) {
            log.debug("Mouth frame {} dropped: {}", dropped.frameIndex(), dropped.cause().toString());
        }
    }

    @Override
    public void onError(LinkErrorEvent event) {
        log.error("Link error: {}", event.message(), event.cause());
    }
}
