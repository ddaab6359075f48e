package com.phillippitts.cvtailor.domain;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bundle describing a finished generation run.
 *
 * @param primary        {@code null} when the run failed before any primary content existed
 * @param partialFailure {@code true} when the run completed but a secondary document failed
 *                       or the primary missed its page target
 * @param error          terminal error message for failed runs, otherwise {@code null}
 */
public record GenerationResult(
        String sessionId,
        SessionState state,
        JobContext job,
        PrimaryOutcome primary,
        Map<DocumentType, SecondaryOutcome> secondaries,
        boolean partialFailure,
        String error
) {
    public GenerationResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        secondaries = secondaries == null || secondaries.isEmpty()
                ? Map.of() : Map.copyOf(new EnumMap<>(secondaries));
    }

    public static GenerationResult failed(String sessionId, JobContext job, String error) {
        return new GenerationResult(sessionId, SessionState.FAILED, job, null, Map.of(), false, error);
    }
}
