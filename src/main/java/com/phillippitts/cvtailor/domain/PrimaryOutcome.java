package com.phillippitts.cvtailor.domain;

/**
 * Persisted summary of the primary document for a run.
 */
public record PrimaryOutcome(
        boolean success,
        Integer pageCount,
        int attempts,
        String error,
        String changeSummary,
        String sourcePath,
        String compiledPath
) {
}
