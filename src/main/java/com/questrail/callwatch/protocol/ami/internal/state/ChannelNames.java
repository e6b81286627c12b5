package com.questrail.callwatch.protocol.ami.internal.state;

import java.util.Optional;

/**
 * Helpers for channel names of the form {@code TECH/peer-suffix}.
 */
final class ChannelNames
{
    private ChannelNames() {
    }

    /**
     * The peer (endpoint) part of a channel name.
     *
     * <pre>
     *   PJSIP/101-0000001a        → 101
     *   SIP/alice@pbx-00000003    → alice
     *   DAHDI/1-1                 → 1
     *   Local/101@from-internal;1 → empty (internal plumbing)
     * </pre>
     */
    static Optional<String> peer(String channel)
    {
        if (channel == null) {
            return Optional.empty();
        }
        int slash = channel.indexOf('/');
        if (slash <= 0 || slash == channel.length() - 1) {
            return Optional.empty();
        }
        if (channel.regionMatches(true, 0, "Local", 0, slash)) {
            return Optional.empty();
        }

        String rest = channel.substring(slash + 1);
        int dash = rest.lastIndexOf('-');
        if (dash > 0) {
            rest = rest.substring(0, dash);
        }
        int at = rest.indexOf('@');
        if (at > 0) {
            rest = rest.substring(0, at);
        }
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }
}
