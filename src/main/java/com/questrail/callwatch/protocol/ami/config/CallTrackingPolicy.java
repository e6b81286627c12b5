package com.questrail.callwatch.protocol.ami.config;

import com.questrail.callwatch.api.ConfigurationException;
import com.questrail.callwatch.api.EndCause;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules the call state tracker applies to the event stream.
 *
 * @param extensions          which local extensions are monitored
 * @param originatingContexts dialplan contexts in which a channel that starts
 *                            dialing is an outbound call placed by the extension
 * @param internalNumber      a remote number matching this is another local
 *                            extension, so the call is internal
 * @param endedGrace          how long an ended call stays queryable
 * @param causeOverrides      hangup cause codes mapped differently from the
 *                            built-in table
 */
public record CallTrackingPolicy(
        ExtensionFilter extensions,
        Set<String> originatingContexts,
        Pattern internalNumber,
        Duration endedGrace,
        Map<Integer, EndCause> causeOverrides
) {
    public static final Pattern DEFAULT_INTERNAL_NUMBER = Pattern.compile("^\\d{2,5}$");

    public CallTrackingPolicy {
        Objects.requireNonNull(extensions, "extensions");
        Objects.requireNonNull(internalNumber, "internalNumber");
        Objects.requireNonNull(endedGrace, "endedGrace");
        originatingContexts = Set.copyOf(Objects.requireNonNull(originatingContexts, "originatingContexts"));
        causeOverrides = Map.copyOf(Objects.requireNonNull(causeOverrides, "causeOverrides"));

        if (endedGrace.isNegative()) {
            throw new ConfigurationException("endedGrace must be >= 0");
        }
    }

    /**
     * All extensions, {@code from-internal} as the originating context, 2 to 5
     * digit internal numbers, 5 s grace and no overrides.
     */
    public static CallTrackingPolicy defaults() {
        return new CallTrackingPolicy(ExtensionFilter.all(), Set.of("from-internal"),
                DEFAULT_INTERNAL_NUMBER, Duration.ofSeconds(5), Map.of());
    }

    public CallTrackingPolicy withExtensions(ExtensionFilter extensions) {
        return new CallTrackingPolicy(extensions, originatingContexts, internalNumber, endedGrace, causeOverrides);
    }

    public CallTrackingPolicy withEndedGrace(Duration endedGrace) {
        return new CallTrackingPolicy(extensions, originatingContexts, internalNumber, endedGrace, causeOverrides);
    }

    public CallTrackingPolicy withCauseOverrides(Map<Integer, EndCause> causeOverrides) {
        return new CallTrackingPolicy(extensions, originatingContexts, internalNumber, endedGrace, causeOverrides);
    }

    public CallTrackingPolicy withOriginatingContexts(Set<String> originatingContexts) {
        return new CallTrackingPolicy(extensions, originatingContexts, internalNumber, endedGrace, causeOverrides);
    }
}
