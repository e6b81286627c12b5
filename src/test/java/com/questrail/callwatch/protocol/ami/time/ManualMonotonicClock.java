package com.questrail.callwatch.protocol.ami.time;

import com.questrail.callwatch.protocol.ami.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven {@link MonotonicClock}. Time moves only through the
 * {@code advance*} methods.
 *
 * <p>Starts at an arbitrary non-zero origin, like {@link System#nanoTime()},
 * so code that treats zero as "unset" shows up in tests.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private static final long ORIGIN = 7_000_000_000_000L;

    private final AtomicLong now = new AtomicLong(ORIGIN);

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long nanos) {
        if (nanos < 0) {
            throw new IllegalArgumentException("time cannot run backwards: " + nanos);
        }
        now.addAndGet(nanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(Duration.ofMillis(millis).toNanos());
    }

    public void advance(Duration d) {
        advanceNanos(d.toNanos());
    }
}
