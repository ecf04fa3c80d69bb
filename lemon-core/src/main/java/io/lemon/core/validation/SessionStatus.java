package io.lemon.core.validation;

/// Lifecycle of a {@link ValidationSession}.
///
/// ```
/// IN_PROGRESS -> COMPLETED
/// IN_PROGRESS -> ABANDONED
/// ```
/// Both end states are terminal.
public enum SessionStatus {
    IN_PROGRESS,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
