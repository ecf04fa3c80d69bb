package io.lemon.core.generation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Inputs shown to a human validator. Deliberately carries no expected output:
/// that is what the validator supplies.
///
/// @param id short case identifier
/// @param inputs input values by input name, unmodifiable
public record ValidationCase(String id, Map<String, Object> inputs) {

    public ValidationCase {
        Objects.requireNonNull(id, "id must not be null");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}
