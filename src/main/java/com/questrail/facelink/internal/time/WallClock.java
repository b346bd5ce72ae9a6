package com.questrail.facelink.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability timestamps only. Never used for deadlines.
 */
public interface WallClock
{
    Instant now();
}
