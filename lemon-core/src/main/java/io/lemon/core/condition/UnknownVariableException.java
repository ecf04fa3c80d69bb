package io.lemon.core.condition;

import java.io.Serial;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A condition referenced a variable that is not present in the evaluation context.
public class UnknownVariableException extends ConditionException {
    @Serial private static final long serialVersionUID = 6046157238809217792L;

    private final String variable;
    private final List<String> available;

    public UnknownVariableException(String variable, List<String> available, String expression) {
        super(
                "Unknown variable '" + variable + "'. Available: " + available,
                Map.of("variable", variable, "available", List.copyOf(available)),
                expression);
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.available = List.copyOf(available);
    }

    public String getVariable() {
        return variable;
    }

    /// Returns the variable names that were available, sorted.
    ///
    /// @return unmodifiable list, never null
    public List<String> getAvailable() {
        return available;
    }
}
