package com.questrail.facelink.api;

import com.questrail.facelink.protocol.model.DeviceCommand;

/**
 * Send path that never waits for or consumes a response.
 *
 * <p>Each {@link #send(DeviceCommand)} writes exactly one line with one atomic
 * transport write, so it cannot interleave with a line written by the primary
 * command flow.</p>
 */
@FunctionalInterface
public interface FireAndForgetChannel
{
    /**
     * @throws com.questrail.facelink.transport.TransportException if the write fails
     */
    void send(DeviceCommand command);
}
