package io.lemon.core.exception;

import java.io.Serial;
import java.util.Map;

public class SessionNotFoundException extends LemonException {
    @Serial private static final long serialVersionUID = 7180244529671023516L;

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId, Map.of("session_id", String.valueOf(sessionId)));
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
