package com.phillippitts.cvtailor.exception;

/**
 * Base type for failures of the text-generation backend.
 */
public abstract class GenerationBackendException extends CvTailorException {

    protected GenerationBackendException(String message) {
        super(message);
    }

    protected GenerationBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} when repeating the same call may succeed
     */
    public abstract boolean isRetryable();
}
