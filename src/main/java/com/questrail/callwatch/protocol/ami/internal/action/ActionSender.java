package com.questrail.callwatch.protocol.ami.internal.action;

import com.questrail.callwatch.protocol.ami.model.AmiAction;

/**
 * Outbound path used by {@link ActionCorrelator}.
 */
@FunctionalInterface
public interface ActionSender
{
    /**
     * Write a fully tagged action to the current connection.
     *
     * @return {@code false} if there is no usable connection; nothing was sent
     */
    boolean send(AmiAction action);
}
