package io.lemon.core.workflow.block;

/// Value kinds an {@link InputBlock} may declare.
public enum InputType {
    INT,
    FLOAT,
    BOOL,
    STRING,
    ENUM,
    DATE;

    /// Returns whether values of this kind are numeric and may carry a {@link NumericRange}.
    ///
    /// @return true for {@link #INT} and {@link #FLOAT}
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
