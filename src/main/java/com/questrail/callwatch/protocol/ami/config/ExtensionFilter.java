package com.questrail.callwatch.protocol.ami.config;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which local extensions are monitored.
 *
 * <p>Immutable; replace the whole filter to change it at runtime.</p>
 */
public abstract class ExtensionFilter
{
    private static final ExtensionFilter ALL = new ExtensionFilter() {
        @Override
        public boolean accepts(String extension) {
            return extension != null && !extension.isEmpty();
        }

        @Override
        public String toString() {
            return "ExtensionFilter[all]";
        }
    };

    ExtensionFilter() {
    }

    public abstract boolean accepts(String extension);

    /**
     * Monitor every extension.
     */
    public static ExtensionFilter all() {
        return ALL;
    }

    /**
     * Monitor exactly the given extensions.
     */
    public static ExtensionFilter of(Set<String> extensions) {
        Set<String> copy = Set.copyOf(Objects.requireNonNull(extensions, "extensions"));
        return new ExtensionFilter() {
            @Override
            public boolean accepts(String extension) {
                return extension != null && copy.contains(extension);
            }

            @Override
            public String toString() {
                return "ExtensionFilter" + copy;
            }
        };
    }

    public static ExtensionFilter of(String... extensions) {
        return of(Set.of(extensions));
    }

    /**
     * Monitor extensions that match {@code pattern} in full.
     */
    public static ExtensionFilter matching(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return new ExtensionFilter() {
            @Override
            public boolean accepts(String extension) {
                return extension != null && pattern.matcher(extension).matches();
            }

            @Override
            public String toString() {
                return "ExtensionFilter[/" + pattern.pattern() + "/]";
            }
        };
    }
}
