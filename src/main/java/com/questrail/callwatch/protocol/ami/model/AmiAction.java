package com.questrail.callwatch.protocol.ami.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AmiAction
 * -----------------------------------------------------------------------------
 * Immutable outbound command. The first field is always {@code Action}.
 *
 * <p>Values may not contain CR or LF: a line break inside a value would let a
 * caller smuggle extra fields, or a premature block terminator, onto the wire.</p>
 */
public final class AmiAction {

    public static final String ACTION = "Action";

    private final List<AmiFields.Entry> fields;

    private AmiAction(List<AmiFields.Entry> fields) {
        this.fields = List.copyOf(fields);
    }

    public static Builder named(String action) {
        return new Builder(action);
    }

    public String name() {
        return fields.get(0).value();
    }

    public List<AmiFields.Entry> fields() {
        return fields;
    }

    public Optional<String> get(String name) {
        for (AmiFields.Entry e : fields) {
            if (e.name().equalsIgnoreCase(name)) {
                return Optional.of(e.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy tagged with the given correlation id, replacing any
     * existing {@code ActionID}.
     */
    public AmiAction withActionId(String actionId) {
        List<AmiFields.Entry> copy = new ArrayList<>(fields.size() + 1);
        for (AmiFields.Entry e : fields) {
            if (!e.name().equalsIgnoreCase(AmiMessage.ACTION_ID)) {
                copy.add(e);
            }
        }
        copy.add(1, new AmiFields.Entry(AmiMessage.ACTION_ID, requireSingleLine(actionId)));
        return new AmiAction(copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AmiAction{");
        for (int i = 0; i < fields.size(); i++) {
            AmiFields.Entry e = fields.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            // Never log credentials.
            String value = e.name().equalsIgnoreCase("Secret") ? "****" : e.value();
            sb.append(e.name()).append('=').append(value);
        }
        return sb.append('}').toString();
    }

    private static String requireSingleLine(String value) {
        Objects.requireNonNull(value, "value");
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Action field values must not contain line breaks");
        }
        return value;
    }

    public static final class Builder {
        private final List<AmiFields.Entry> fields = new ArrayList<>();

        private Builder(String action) {
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("action name must not be blank");
            }
            fields.add(new AmiFields.Entry(ACTION, requireSingleLine(action)));
        }

        public Builder field(String name, String value) {
            if (name == null || name.isBlank() || name.indexOf(':') >= 0) {
                throw new IllegalArgumentException("Invalid field name: " + name);
            }
            fields.add(new AmiFields.Entry(requireSingleLine(name), requireSingleLine(value)));
            return this;
        }

        public AmiAction build() {
            return new AmiAction(fields);
        }
    }
}
