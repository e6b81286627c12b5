package com.questrail.callwatch.api;

/**
 * EndCause
 * -----------------------------------------------------------------------------
 * Coarse reason a call ended.
 *
 * <p>Server-specific hangup cause codes are mapped onto this small set by a
 * configurable lookup table. Codes the table does not know map to
 * {@link #UNKNOWN}.</p>
 */
public enum EndCause
{
    NORMAL_CLEARING("normal clearing"),
    NO_ANSWER("no answer"),
    BUSY("busy"),
    FAILED("failed"),
    CONNECTION_LOST("connection lost"),
    UNKNOWN("unknown");

    private final String label;

    EndCause(String label)
    {
        this.label = label;
    }

    /**
     * Human-readable label, e.g. {@code "no answer"}.
     */
    public String label()
    {
        return label;
    }

    @Override
    public String toString()
    {
        return label;
    }
}
