package com.questrail.facelink.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle notifications from a transport. They carry no protocol meaning.
 */
public sealed interface LinkTransportEvent
        permits LinkTransportEvent.Opened, LinkTransportEvent.Closed
{
    Instant timestamp();

    String endpoint();

    /** Port opened or socket connected. */
    record Opened(Instant timestamp, String endpoint) implements LinkTransportEvent {
        public Opened {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(endpoint, "endpoint");
        }
    }

    /**
     * Stream ended, locally or by the peer.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    record Closed(Instant timestamp, String endpoint, Throwable cause) implements LinkTransportEvent {
        public Closed {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(endpoint, "endpoint");
        }
    }
}
