package com.phillippitts.cvtailor.exception;

/**
 * Backend failure that repeating the call will not fix, including exhausted transient retries.
 */
public class PermanentBackendException extends GenerationBackendException {

    private final int attempts;

    public PermanentBackendException(String message) {
        super(message);
        this.attempts = 1;
    }

    public PermanentBackendException(String message, Throwable cause) {
        super(message, cause);
        this.attempts = 1;
    }

    public PermanentBackendException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
