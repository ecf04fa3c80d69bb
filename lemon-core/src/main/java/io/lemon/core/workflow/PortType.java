package io.lemon.core.workflow;

/// Connection port on a block. Decisions emit on {@link #TRUE} or {@link #FALSE};
/// every other block emits on {@link #DEFAULT}.
public enum PortType {
    DEFAULT,
    TRUE,
    FALSE;

    /// Returns the port a decision follows for the given result.
    ///
    /// @param result the evaluated condition
    /// @return {@link #TRUE} or {@link #FALSE}, never null
    public static PortType forDecision(boolean result) {
        return result ? TRUE : FALSE;
    }
}
