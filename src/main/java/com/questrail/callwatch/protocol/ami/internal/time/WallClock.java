package com.questrail.callwatch.protocol.ami.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for user-facing call timestamps and observability records.
 * Never used for deadlines.
 */
public interface WallClock
{
    Instant now();
}
