package com.phillippitts.cvtailor.exception;

/**
 * Base exception for all cv-tailor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CvTailorException extends RuntimeException {

    public CvTailorException(String message) {
        super(message);
    }

    public CvTailorException(String message, Throwable cause) {
        super(message, cause);
    }

    public CvTailorException(Throwable cause) {
        super(cause);
    }
}
