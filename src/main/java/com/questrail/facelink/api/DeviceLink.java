package com.questrail.facelink.api;

import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;

import java.time.Duration;
import java.util.List;

/**
 * DeviceLink
 * =============================================================================
 * Command/response/event session with one display device.
 *
 * <h2>One outstanding command</h2>
 * The wire protocol has no request identifiers. A response is matched to the
 * command that is outstanding when it arrives, so at most one
 * response-awaiting exchange may be in flight. Implementations enforce this
 * with an exclusive command token held for the whole of
 * {@link #sendCommand(DeviceCommand, Duration)} and
 * {@link #sendBinaryPayload(byte[])}.
 *
 * <h2>Fire-and-forget</h2>
 * Sends that must not wait for, or consume, a response go through
 * {@link #fireAndForget()}. That channel is a separate type so a caller
 * holding it cannot accidentally take part in response matching.
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>Transport failures throw {@code TransportException}; the link is unusable afterwards.</li>
 *   <li>A missing response is not an exception: {@link DeviceResponse#timeout()} is returned.</li>
 *   <li>Lines that are not protocol traffic are dropped silently.</li>
 * </ul>
 */
public interface DeviceLink extends AutoCloseable
{
    /**
     * Send a command and wait for its response using the default response timeout.
     */
    DeviceResponse sendCommand(DeviceCommand command);

    /**
     * Send a command and wait up to {@code timeout} for its response.
     *
     * <p>Events that arrive while waiting are queued for {@link #collectEvents()}.</p>
     *
     * @return the first status line received, or the timeout sentinel
     */
    DeviceResponse sendCommand(DeviceCommand command, Duration timeout);

    /**
     * Transfer a binary payload (an encoded JPEG) with the three-phase image handshake.
     *
     * @return the device's final status, or the phase-1 response if it was not {@code ready}
     */
    DeviceResponse sendBinaryPayload(byte[] payload);

    /**
     * Harvest events without blocking.
     *
     * <p>Reads whatever the transport has buffered, then atomically drains the
     * event queue, including events that arrived during earlier commands.</p>
     */
    List<DeviceEvent> collectEvents();

    /**
     * Let the device finish booting, then discard everything it printed.
     */
    void drainBoot(Duration wait);

    /**
     * The response-free send path.
     */
    FireAndForgetChannel fireAndForget();

    @Override
    void close();
}
