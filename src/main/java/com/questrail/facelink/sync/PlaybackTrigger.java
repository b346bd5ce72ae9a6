package com.questrail.facelink.sync;

import java.io.IOException;
import java.net.URI;

/**
 * Asks a remote speaker to start playing a clip.
 *
 * <p>Returns once the request has been accepted; playback itself is not awaited.</p>
 */
@FunctionalInterface
public interface PlaybackTrigger
{
    void trigger(URI playEndpoint, URI audioUrl) throws IOException, InterruptedException;
}
