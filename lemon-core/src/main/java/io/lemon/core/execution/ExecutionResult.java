package io.lemon.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of executing a workflow.
///
/// Failures are data, not exceptions: input validation errors, dead ends,
/// composition cycles and step-cap exhaustion all produce a result with an
/// `error` and no `output`.
///
/// @param output value of the reached output block, null on failure
/// @param path ids of the visited non-input blocks in order, never null
/// @param error failure description, null on success
/// @param context variable state at the end of execution, never null
public record ExecutionResult(
        String output, List<String> path, String error, Map<String, Object> context) {

    public ExecutionResult {
        path = path != null ? List.copyOf(path) : List.of();
        context =
                context != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                        : Map.of();
    }

    public static ExecutionResult success(
            String output, List<String> path, Map<String, Object> context) {
        return new ExecutionResult(output, path, null, context);
    }

    public static ExecutionResult failure(String error, List<String> path) {
        return new ExecutionResult(null, path, error, null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(null, List.of(), error, null);
    }

    /// Returns whether execution reached an output without error.
    ///
    /// @return true iff `error` is null and `output` is set
    public boolean success() {
        return error == null && output != null;
    }
}
