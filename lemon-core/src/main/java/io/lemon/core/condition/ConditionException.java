package io.lemon.core.condition;

import io.lemon.core.exception.LemonException;
import java.io.Serial;
import java.util.Map;

/// Base type for failures while parsing or evaluating a decision condition.
public class ConditionException extends LemonException {
    @Serial private static final long serialVersionUID = 2983441375025307115L;

    private final String expression;

    public ConditionException(String message, String expression) {
        super(message, expression != null ? Map.of("expression", expression) : Map.of());
        this.expression = expression;
    }

    protected ConditionException(String message, Map<String, Object> context, String expression) {
        super(message, context);
        this.expression = expression;
    }

    /// Returns the condition text that failed.
    ///
    /// @return the expression, may be null when the failure is not tied to one
    public String getExpression() {
        return expression;
    }
}
