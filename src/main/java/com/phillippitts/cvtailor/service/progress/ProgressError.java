package com.phillippitts.cvtailor.service.progress;

/**
 * Error payload.
 *
 * @param terminal {@code false} for advisory errors (a failed secondary document) after which
 *                 the run continues
 */
public record ProgressError(String errorCode, String message, boolean terminal) {
}
