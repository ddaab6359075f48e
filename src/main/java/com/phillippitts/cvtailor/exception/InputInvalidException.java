package com.phillippitts.cvtailor.exception;

/**
 * Thrown when a generation or mutation request is rejected before any work starts
 * (blank job input, unknown document type, missing source CV).
 */
public class InputInvalidException extends CvTailorException {

    private final String reason;

    public InputInvalidException(String reason) {
        super("Invalid input: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
