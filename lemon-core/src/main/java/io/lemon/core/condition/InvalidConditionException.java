package io.lemon.core.condition;

import java.io.Serial;

/// Condition text is malformed or uses a construct outside the permitted language.
public class InvalidConditionException extends ConditionException {
    @Serial private static final long serialVersionUID = -4410526370962841093L;

    public InvalidConditionException(String message, String expression) {
        super(message, expression);
    }
}
