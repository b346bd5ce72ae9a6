package com.questrail.facelink.sync;

import java.io.IOException;
import java.net.URI;

/**
 * Where encoded clips come from.
 */
@FunctionalInterface
public interface AudioSource
{
    byte[] fetch(URI audioUrl) throws IOException, InterruptedException;
}
