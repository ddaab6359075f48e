package com.phillippitts.cvtailor.exception;

/**
 * Thrown when a session is already owned by an in-flight generation run, or changed while a
 * refinement was being prepared.
 */
public class ConcurrentSessionModificationException extends CvTailorException {

    private final String sessionId;

    public ConcurrentSessionModificationException(String sessionId) {
        this(sessionId, "Session is currently being processed: " + sessionId);
    }

    public ConcurrentSessionModificationException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
