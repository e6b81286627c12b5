package com.questrail.callwatch.protocol.ami.internal.state;

import com.questrail.callwatch.api.EndCause;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps Q.850 hangup cause codes, as reported in the {@code Cause} field of a
 * {@code Hangup} event, onto {@link EndCause}.
 *
 * <p>Codes without an entry, and values that are not integers, map to
 * {@link EndCause#UNKNOWN}.</p>
 */
public final class HangupCauseTable
{
    private static final Map<Integer, EndCause> DEFAULTS = Map.ofEntries(
        Map.entry(16, EndCause.NORMAL_CLEARING),
        Map.entry(31, EndCause.NORMAL_CLEARING),
        Map.entry(26, EndCause.NORMAL_CLEARING),   // answered elsewhere
        Map.entry(17, EndCause.BUSY),
        Map.entry(21, EndCause.BUSY),              // call rejected
        Map.entry(18, EndCause.NO_ANSWER),
        Map.entry(19, EndCause.NO_ANSWER),
        Map.entry(1, EndCause.FAILED),
        Map.entry(3, EndCause.FAILED),
        Map.entry(22, EndCause.FAILED),
        Map.entry(27, EndCause.FAILED),
        Map.entry(28, EndCause.FAILED),
        Map.entry(34, EndCause.FAILED),
        Map.entry(38, EndCause.FAILED),
        Map.entry(41, EndCause.FAILED),
        Map.entry(42, EndCause.FAILED),
        Map.entry(44, EndCause.FAILED),
        Map.entry(58, EndCause.FAILED),
        Map.entry(127, EndCause.FAILED)
    );

    private final Map<Integer, EndCause> table;

    public HangupCauseTable()
    {
        this(Map.of());
    }

    public HangupCauseTable(Map<Integer, EndCause> overrides)
    {
        Objects.requireNonNull(overrides, "overrides");
        Map<Integer, EndCause> merged = new HashMap<>(DEFAULTS);
        merged.putAll(overrides);
        this.table = Map.copyOf(merged);
    }

    public EndCause classify(int code)
    {
        return table.getOrDefault(code, EndCause.UNKNOWN);
    }

    public EndCause classify(String causeField)
    {
        if (causeField == null) {
            return EndCause.UNKNOWN;
        }
        try {
            return classify(Integer.parseInt(causeField.trim()));
        }
        catch (NumberFormatException e) {
            return EndCause.UNKNOWN;
        }
    }
}
