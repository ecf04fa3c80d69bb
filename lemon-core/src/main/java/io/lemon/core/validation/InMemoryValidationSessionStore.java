package io.lemon.core.validation;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory session store (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryValidationSessionStore implements ValidationSessionStore {

    private final Map<String, ValidationSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void put(ValidationSession session) {
        Objects.requireNonNull(session, "session must not be null");
        sessions.put(session.getId(), session);
    }

    @Override
    public Optional<ValidationSession> get(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean remove(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return sessions.remove(sessionId) != null;
    }

    @Override
    public Collection<ValidationSession> all() {
        return List.copyOf(sessions.values());
    }

    /// Clears all sessions (useful for testing).
    public void clear() {
        sessions.clear();
    }
}
