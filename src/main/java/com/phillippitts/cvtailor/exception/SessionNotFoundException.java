package com.phillippitts.cvtailor.exception;

/**
 * Thrown when a session id does not resolve to a persisted session for the requesting owner.
 */
public class SessionNotFoundException extends CvTailorException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
