package com.questrail.callwatch.protocol.ami.config;

import com.questrail.callwatch.api.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Idle detection for an authenticated connection.
 *
 * @param idleThreshold  silence after which a {@code Ping} is sent
 * @param responseGrace  how long the {@code Ping} may go unanswered before the
 *                       connection is declared dead
 */
public record KeepAlivePolicy(Duration idleThreshold, Duration responseGrace) {

    public KeepAlivePolicy {
        Objects.requireNonNull(idleThreshold, "idleThreshold");
        Objects.requireNonNull(responseGrace, "responseGrace");
        if (idleThreshold.isNegative() || idleThreshold.isZero()) {
            throw new ConfigurationException("idleThreshold must be > 0");
        }
        if (responseGrace.isNegative() || responseGrace.isZero()) {
            throw new ConfigurationException("responseGrace must be > 0");
        }
    }

    public static KeepAlivePolicy defaults() {
        return new KeepAlivePolicy(Duration.ofSeconds(30), Duration.ofSeconds(10));
    }
}
