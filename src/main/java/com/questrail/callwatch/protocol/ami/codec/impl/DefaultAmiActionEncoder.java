package com.questrail.callwatch.protocol.ami.codec.impl;

import com.questrail.callwatch.protocol.ami.codec.AmiActionEncoder;
import com.questrail.callwatch.protocol.ami.model.AmiAction;
import com.questrail.callwatch.protocol.ami.model.AmiFields;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultAmiActionEncoder
 * -----------------------------------------------------------------------------
 * Writes each field as {@code Name: Value\r\n}, in order, followed by the
 * terminating {@code \r\n}.
 */
public final class DefaultAmiActionEncoder implements AmiActionEncoder
{
    private static final String CRLF = "\r\n";

    @Override
    public byte[] encode(AmiAction action)
    {
        Objects.requireNonNull(action, "action");

        StringBuilder sb = new StringBuilder(64);
        for (AmiFields.Entry field : action.fields()) {
            sb.append(field.name()).append(": ").append(field.value()).append(CRLF);
        }
        sb.append(CRLF);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
