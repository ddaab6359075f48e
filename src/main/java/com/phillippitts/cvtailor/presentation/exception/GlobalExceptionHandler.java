package com.phillippitts.cvtailor.presentation.exception;

import com.phillippitts.cvtailor.exception.ArtifactNotFoundException;
import com.phillippitts.cvtailor.exception.CompileException;
import com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException;
import com.phillippitts.cvtailor.exception.ErrorCodes;
import com.phillippitts.cvtailor.exception.GenerationBackendException;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.exception.SessionLockedException;
import com.phillippitts.cvtailor.exception.SessionNotFoundException;
import com.phillippitts.cvtailor.exception.StorageException;
import com.phillippitts.cvtailor.exception.UpstreamFetchException;
import com.phillippitts.cvtailor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses. Storage paths, compiler output and stack
 * traces are logged server-side only.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InputInvalidException.class)
    ResponseEntity<ApiError> handleInputInvalid(InputInvalidException ex) {
        LOG.warn("Invalid input: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ErrorCodes.of(ex), "Invalid input", ex.getMessage());
    }

    /**
     * Missing owner header or unreadable body (HTTP 400).
     */
    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", LogSanitizer.singleLine(ex.getMessage()));
        String details = ex instanceof MissingRequestHeaderException missing
                ? "Missing header " + missing.getHeaderName()
                : "Request body is missing or not valid JSON";
        return error(HttpStatus.BAD_REQUEST, "INPUT_INVALID", "Invalid request", details);
    }

    /**
     * Approved sessions are read-only (HTTP 403).
     */
    @ExceptionHandler(SessionLockedException.class)
    ResponseEntity<ApiError> handleSessionLocked(SessionLockedException ex) {
        LOG.info("Rejected change to locked session {}", ex.getSessionId());
        return error(HttpStatus.FORBIDDEN, ErrorCodes.of(ex), "Session is approved and locked",
                "Start a new session to make further changes");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ErrorCodes.of(ex), "Session not found", ex.getMessage());
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    ResponseEntity<ApiError> handleArtifactNotFound(ArtifactNotFoundException ex) {
        LOG.info("Artifact not found: session={}, type={}", ex.getSessionId(), ex.getDocumentType());
        return error(HttpStatus.NOT_FOUND, ErrorCodes.of(ex), "Document not found", ex.getMessage());
    }

    /**
     * A generation run owns the session (HTTP 409). Retry after it finishes.
     */
    @ExceptionHandler(ConcurrentSessionModificationException.class)
    ResponseEntity<ApiError> handleConcurrentModification(ConcurrentSessionModificationException ex) {
        LOG.info("Session {} is busy", ex.getSessionId());
        return error(HttpStatus.CONFLICT, ErrorCodes.of(ex), "Session is being generated",
                "Retry once the running generation has finished");
    }

    /**
     * Refined CV did not compile (HTTP 422). Nothing was stored.
     */
    @ExceptionHandler(CompileException.class)
    ResponseEntity<ApiError> handleCompileFailure(CompileException ex) {
        LOG.warn("Compile failed: tool={}, {}", ex.getToolName(), LogSanitizer.truncate(ex.getDiagnostics(), 500));
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.of(ex), "Document did not compile",
                "The previous version was kept");
    }

    /**
     * Job posting link could not be fetched (HTTP 502).
     */
    @ExceptionHandler(UpstreamFetchException.class)
    ResponseEntity<ApiError> handleUpstreamFetch(UpstreamFetchException ex) {
        LOG.warn("Upstream fetch failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ErrorCodes.of(ex), "Could not fetch the job posting",
                "Paste the job description text instead");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(GenerationBackendException.class)
    ResponseEntity<ApiError> handleBackendFailure(GenerationBackendException ex) {
        LOG.error("Generation backend failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorCodes.of(ex), "Generation service temporarily unavailable",
                "Please retry in a few seconds");
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOG.error("Storage failure at {}", ex.getPath(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCodes.of(ex), "Storage failure",
                "Please contact support with request ID");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
