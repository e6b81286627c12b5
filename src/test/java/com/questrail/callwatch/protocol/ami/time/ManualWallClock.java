package com.questrail.callwatch.protocol.ami.time;

import com.questrail.callwatch.protocol.ami.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock that only moves when told to.
 */
public final class ManualWallClock implements WallClock {

    private volatile Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }
}
