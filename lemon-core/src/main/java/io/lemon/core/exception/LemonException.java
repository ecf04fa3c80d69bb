package io.lemon.core.exception;

import java.io.Serial;
import java.util.Map;
import java.util.stream.Collectors;

/// Base type for checked engine failures.
///
/// Carries an optional immutable context map with the identifiers involved in the
/// failure (workflow id, session id, variable name). The context is rendered by
/// {@link #toString()} but never by {@link #getMessage()}.
public class LemonException extends Exception {
    @Serial private static final long serialVersionUID = 4021399183476218830L;

    private final transient Map<String, Object> context;

    public LemonException(String message) {
        this(message, Map.of());
    }

    public LemonException(String message, Map<String, Object> context) {
        super(message);
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public LemonException(String message, Throwable cause) {
        super(message, cause);
        this.context = Map.of();
    }

    /// Returns the failure context.
    ///
    /// @return unmodifiable context map, never null (may be empty)
    public Map<String, Object> getContext() {
        return context != null ? context : Map.of();
    }

    @Override
    public String toString() {
        Map<String, Object> ctx = getContext();
        if (ctx.isEmpty()) {
            return getClass().getName() + ": " + getMessage();
        }
        String rendered =
                ctx.entrySet().stream()
                        .sorted(Map.Entry.comparingByKey())
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
        return getClass().getName() + ": " + getMessage() + " | context={" + rendered + "}";
    }
}
