package com.phillippitts.cvtailor.exception;

/**
 * Stable error codes used on the progress stream.
 */
public final class ErrorCodes {

    private ErrorCodes() {
    }

    public static String of(Throwable error) {
        if (error instanceof InputInvalidException) {
            return "INPUT_INVALID";
        }
        if (error instanceof SessionNotFoundException) {
            return "SESSION_NOT_FOUND";
        }
        if (error instanceof ArtifactNotFoundException) {
            return "ARTIFACT_NOT_FOUND";
        }
        if (error instanceof SessionLockedException) {
            return "SESSION_LOCKED";
        }
        if (error instanceof ConcurrentSessionModificationException) {
            return "SESSION_BUSY";
        }
        if (error instanceof UpstreamFetchException) {
            return "UPSTREAM_FETCH_FAILED";
        }
        if (error instanceof GenerationBackendException) {
            return "GENERATION_BACKEND_UNAVAILABLE";
        }
        if (error instanceof CompileException) {
            return "COMPILE_FAILED";
        }
        if (error instanceof StorageException) {
            return "STORAGE_FAILED";
        }
        return "INTERNAL_ERROR";
    }
}
