package com.questrail.callwatch.protocol.ami.codec;

import com.questrail.callwatch.protocol.ami.model.AmiAction;

/**
 * AmiActionEncoder
 * -----------------------------------------------------------------------------
 * Outbound wire boundary: turns a validated {@link AmiAction} into the bytes
 * written to the connection.
 *
 * <p>The encoder does not decide what to send and does not assign correlation
 * ids; it only applies the line and block terminator rules.</p>
 */
public interface AmiActionEncoder
{
    /**
     * Encode one action as a complete block, including the terminating empty line.
     */
    byte[] encode(AmiAction action);
}
