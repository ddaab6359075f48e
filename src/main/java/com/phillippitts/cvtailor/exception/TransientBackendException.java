package com.phillippitts.cvtailor.exception;

/**
 * Rate limiting, overload or a network timeout. The call may be repeated.
 */
public class TransientBackendException extends GenerationBackendException {

    private final int statusCode;

    public TransientBackendException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status that caused the failure, or -1 for transport errors
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
