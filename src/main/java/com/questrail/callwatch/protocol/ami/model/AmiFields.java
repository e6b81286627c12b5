package com.questrail.callwatch.protocol.ami.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AmiFields
 * -----------------------------------------------------------------------------
 * Immutable, ordered multimap of {@code Name: Value} pairs from one protocol
 * block.
 *
 * <ul>
 *   <li>Insertion order is preserved across all entries.</li>
 *   <li>A name may repeat (e.g. several {@code Variable} lines); every value is
 *       kept, in wire order.</li>
 *   <li>Lookup is case-insensitive; the original spelling of each name is
 *       still available from {@link #entries()} and {@link #names()}.</li>
 * </ul>
 */
public final class AmiFields
{
    /**
     * One raw field as it appeared on the wire.
     */
    public record Entry(String name, String value) {
        public Entry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    private static final AmiFields EMPTY = new AmiFields(List.of());

    private final List<Entry> entries;
    private final Map<String, List<String>> byKey;

    private AmiFields(List<Entry> entries) {
        this.entries = List.copyOf(entries);

        Map<String, List<String>> index = new LinkedHashMap<>();
        for (Entry e : this.entries) {
            index.computeIfAbsent(key(e.name()), k -> new ArrayList<>()).add(e.value());
        }
        index.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.byKey = Collections.unmodifiableMap(index);
    }

    public static AmiFields empty() {
        return EMPTY;
    }

    public static AmiFields of(List<Entry> entries) {
        return entries.isEmpty() ? EMPTY : new AmiFields(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * First value for {@code name}, matched case-insensitively.
     */
    public Optional<String> first(String name) {
        List<String> values = byKey.get(key(name));
        return values == null ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * First value for {@code name}, or {@code fallback} when absent.
     */
    public String firstOr(String name, String fallback) {
        return first(name).orElse(fallback);
    }

    /**
     * All values for {@code name} in wire order; empty if the field is absent.
     */
    public List<String> all(String name) {
        return byKey.getOrDefault(key(name), List.of());
    }

    public boolean contains(String name) {
        return byKey.containsKey(key(name));
    }

    /**
     * Distinct field names in first-seen order, in their original case.
     */
    public Set<String> names() {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> keys = new LinkedHashSet<>();
        for (Entry e : entries) {
            if (keys.add(key(e.name()))) {
                seen.add(e.name());
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AmiFields other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(entries.get(i).name()).append('=').append(entries.get(i).value());
        }
        return sb.append('}').toString();
    }

    /**
     * Accumulates entries in order. Not thread-safe.
     */
    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        public Builder add(String name, String value) {
            entries.add(new Entry(name, value));
            return this;
        }

        /**
         * Appends a continuation line to the value of the most recent entry.
         *
         * @return {@code false} if there is no entry to continue
         */
        public boolean appendToLast(String continuation) {
            if (entries.isEmpty()) {
                return false;
            }
            int last = entries.size() - 1;
            Entry prev = entries.get(last);
            entries.set(last, new Entry(prev.name(), prev.value() + "\n" + continuation));
            return true;
        }

        public AmiFields build() {
            return AmiFields.of(entries);
        }
    }
}
