package io.lemon.core.generation;

import java.util.Locale;

/// How {@link CaseGenerator} picks validation inputs.
public enum GenerationStrategy {
    /// Independent random values within each input's constraints.
    RANDOM,
    /// Range ends and values around decision thresholds, one input varied at a time.
    BOUNDARY,
    /// Boundary cases followed by random cases, duplicates removed.
    COMPREHENSIVE;

    /// Parses a strategy name case-insensitively.
    ///
    /// @param value strategy name such as `"boundary"`, not null
    /// @return the strategy, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static GenerationStrategy fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown generation strategy: " + value + " (expected random, boundary or comprehensive)",
                    e);
        }
    }
}
