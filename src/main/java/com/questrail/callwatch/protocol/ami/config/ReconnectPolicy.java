package com.questrail.callwatch.protocol.ami.config;

import com.questrail.callwatch.api.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Exponential backoff for automatic reconnection after network failures.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>baseDelay</b>: delay before the first retry.</li>
 *   <li><b>maxDelay</b>: cap applied after growth and after jitter.</li>
 *   <li><b>multiplier</b>: growth factor per attempt (at least 1).</li>
 *   <li><b>jitter</b>: fraction in [0, 1); the delay is spread uniformly over
 *       {@code ±jitter} of its nominal value.</li>
 *   <li><b>maxAttempts</b>: consecutive failed attempts before giving up;
 *       {@code 0} retries forever.</li>
 * </ul>
 *
 * Authentication failures are never retried regardless of this policy.
 */
public record ReconnectPolicy(
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        double jitter,
        int maxAttempts
) {
    public ReconnectPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new ConfigurationException("baseDelay must be > 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException("maxDelay must be >= baseDelay");
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new ConfigurationException("multiplier must be >= 1");
        }
        if (!(jitter >= 0.0 && jitter < 1.0)) {
            throw new ConfigurationException("jitter must be in [0, 1)");
        }
        if (maxAttempts < 0) {
            throw new ConfigurationException("maxAttempts must be >= 0");
        }
    }

    /**
     * 2 s base, 60 s cap, doubling, 20% jitter, 10 attempts.
     */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(60), 2.0, 0.2, 10);
    }

    public ReconnectPolicy withJitter(double jitter) {
        return new ReconnectPolicy(baseDelay, maxDelay, multiplier, jitter, maxAttempts);
    }

    public ReconnectPolicy withMaxAttempts(int maxAttempts) {
        return new ReconnectPolicy(baseDelay, maxDelay, multiplier, jitter, maxAttempts);
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    /**
     * Delay before the given attempt.
     *
     * @param attempt 1 for the first retry
     * @param random  uniform sample in [0, 1); 0.5 yields the nominal delay
     */
    public Duration delayFor(int attempt, double random) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }

        double capMillis = maxDelay.toMillis();
        double nominal = Math.min(capMillis, baseDelay.toMillis() * Math.pow(multiplier, attempt - 1));
        double factor = 1.0 - jitter + 2.0 * jitter * random;
        long millis = Math.round(Math.min(capMillis, nominal * factor));
        return Duration.ofMillis(Math.max(0L, millis));
    }
}
