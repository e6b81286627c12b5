package com.questrail.callwatch.protocol.ami.internal.decode;

import com.questrail.callwatch.protocol.ami.model.AmiFields;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AmiMessageParser
 * ============================================================================
 * Converts one framed block of text lines into a structured {@link AmiMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between <b>wire mechanics</b> (lines, colons,
 * terminators) and <b>protocol structure</b> (events, responses, named
 * fields). Everything above it reasons exclusively in terms of
 * {@link AmiMessage}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code Name: Value} splits at the first colon; surrounding whitespace
 *       is trimmed from both sides.</li>
 *   <li>A line without a colon (or with an empty name) continues the value of
 *       the previous field, joined with {@code \n}.</li>
 *   <li>Such a line with no previous field is kept as payload.</li>
 *   <li>Unrecognized fields are always retained.</li>
 * </ul>
 *
 * Parsing never fails: the worst case is a message of kind
 * {@link com.questrail.callwatch.protocol.ami.model.MessageKind#UNKNOWN}.
 * Stateless and thread-safe.
 */
public final class AmiMessageParser
{
    public AmiMessage parse(List<String> block)
    {
        Objects.requireNonNull(block, "block");

        AmiFields.Builder fields = AmiFields.builder();
        List<String> payload = new ArrayList<>();

        for (String line : block) {
            int colon = line.indexOf(':');
            String name = colon > 0 ? line.substring(0, colon).trim() : "";

            if (name.isEmpty()) {
                if (!fields.appendToLast(line)) {
                    payload.add(line);
                }
                continue;
            }

            fields.add(name, line.substring(colon + 1).trim());
        }

        return AmiMessage.of(fields.build(), payload);
    }
}
