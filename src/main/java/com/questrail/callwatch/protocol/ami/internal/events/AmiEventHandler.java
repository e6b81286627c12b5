package com.questrail.callwatch.protocol.ami.internal.events;

import com.questrail.callwatch.protocol.ami.model.AmiMessage;

/**
 * Subscriber to the inbound event stream.
 *
 * <p>Invoked synchronously on the read loop, in wire order. Implementations
 * must not block.</p>
 */
@FunctionalInterface
public interface AmiEventHandler
{
    void onEvent(AmiMessage event);
}
