package com.phillippitts.cvtailor.exception;

/**
 * Thrown when a mutating operation targets a session that has been approved.
 * Approval is irreversible, so the request can never succeed for this session.
 */
public class SessionLockedException extends CvTailorException {

    private final String sessionId;

    public SessionLockedException(String sessionId) {
        super("Session is locked and cannot be modified: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
