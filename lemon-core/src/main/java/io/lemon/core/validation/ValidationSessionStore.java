package io.lemon.core.validation;

import java.util.Collection;
import java.util.Optional;

/// Holds live validation sessions for a {@link ValidationSessionManager}.
///
/// Sessions are transient: they need not survive a restart. Only the
/// aggregate score reaches persistent storage, through
/// {@link io.lemon.core.workflow.WorkflowRepository#updateValidation}.
///
/// @see InMemoryValidationSessionStore for the default implementation
public interface ValidationSessionStore {

    /// Stores a session, replacing any with the same id.
    ///
    /// @param session the session, not null
    void put(ValidationSession session);

    /// Looks up a session.
    ///
    /// @param sessionId the session id, not null
    /// @return the session, or empty if unknown
    Optional<ValidationSession> get(String sessionId);

    /// Removes a session.
    ///
    /// @param sessionId the session id, not null
    /// @return true if a session was removed
    boolean remove(String sessionId);

    /// Returns all live sessions.
    ///
    /// @return snapshot of the sessions, never null
    Collection<ValidationSession> all();
}
