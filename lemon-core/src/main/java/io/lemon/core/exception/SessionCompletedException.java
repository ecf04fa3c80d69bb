package io.lemon.core.exception;

import java.io.Serial;
import java.util.Map;

/// Raised when a terminal or exhausted validation session receives a mutating call.
public class SessionCompletedException extends LemonException {
    @Serial private static final long serialVersionUID = -837026613962504410L;

    private final String sessionId;

    public SessionCompletedException(String sessionId, String message) {
        super(message, Map.of("session_id", String.valueOf(sessionId)));
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
