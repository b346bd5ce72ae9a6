package com.questrail.facelink.session;

import com.questrail.facelink.observability.LinkProtocolEvent;
import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceResponse;

import java.util.Objects;

/**
 * ImageTransfer
 * -----------------------------------------------------------------------------
 * Three-phase binary handshake, run while the session's command token is held.
 *
 * <pre>
 *   1. {"cmd":"image","len":N}  →  {"status":"ready"}   (anything else: stop here)
 *   2. N raw bytes, unframed
 *   3.                          ←  {"status":"ok"} | error
 * </pre>
 *
 * <p>Phase 2 is the only place the link leaves line mode. The payload is one
 * write so that no fire-and-forget line can land inside it.</p>
 *
 * <p>The firmware answers the header with {@code ready} or {@code error}, never
 * {@code ok}. An {@code ok} seen in phase 1 is the late acknowledgement of an
 * earlier mouth frame and is skipped.</p>
 */
final class ImageTransfer
{
    private final LinkSession session;
    private final LinkTimingPolicy timing;

    ImageTransfer(LinkSession session, LinkTimingPolicy timing) {
        this.session = Objects.requireNonNull(session, "session");
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    DeviceResponse transfer(byte[] payload) {
        DeviceResponse ready = session.exchange(
                DeviceCommand.image(payload.length), timing.imageReadyTimeout(), response -> !response.isOk());
        if (!ready.isReady()) {
            session.observabilitySink().onProtocolEvent(
                    new LinkProtocolEvent.ImageRejected(session.wallClock().now(), payload.length, ready));
            return ready;
        }

        if (payload.length > 0) {
            session.writeRaw(payload);
        }

        return session.awaitResponse(DeviceCommand.IMAGE, timing.imageCompleteTimeout());
    }
}
