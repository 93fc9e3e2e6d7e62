package com.questrail.gateway.time;

import java.time.Instant;

/**
 * Wall-clock source for human-readable timestamps (session creation time,
 * last activity, observability records). Never used for deadlines.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
