package com.questrail.facelink.observability;

import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * LinkProtocolEvent
 * -----------------------------------------------------------------------------
 * Non-fatal protocol occurrences worth recording.
 *
 * <p>None of these are errors from the caller's point of view: timeouts are
 * returned as a sentinel response, malformed lines are expected during boot,
 * and an image rejection is a normal negative result.</p>
 */
public sealed interface LinkProtocolEvent
        permits LinkProtocolEvent.ResponseTimeout,
                LinkProtocolEvent.MalformedLineDropped,
                LinkProtocolEvent.StaleResponseDropped,
                LinkProtocolEvent.EventDropped,
                LinkProtocolEvent.ImageRejected,
                LinkProtocolEvent.BootOutputDiscarded
{
    Instant timestamp();

    /** No status line arrived for {@code command} within {@code timeout}. */
    record ResponseTimeout(Instant timestamp, String command, Duration timeout) implements LinkProtocolEvent {}

    /** A line that was neither an event nor a response. */
    record MalformedLineDropped(Instant timestamp, String line, String reason) implements LinkProtocolEvent {}

    /** A response arrived while no command was outstanding. */
    record StaleResponseDropped(Instant timestamp, DeviceResponse response) implements LinkProtocolEvent {}

    /** The event queue was full; the oldest event was evicted. */
    record EventDropped(Instant timestamp, DeviceEvent event) implements LinkProtocolEvent {}

    /** The device answered the image header with something other than {@code ready}. */
    record ImageRejected(Instant timestamp, int length, DeviceResponse response) implements LinkProtocolEvent {}

    /** Bytes thrown away by a boot drain. */
    record BootOutputDiscarded(Instant timestamp, int bytes) implements LinkProtocolEvent {}
}
