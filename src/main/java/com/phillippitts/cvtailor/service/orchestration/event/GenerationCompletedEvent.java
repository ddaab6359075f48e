package com.phillippitts.cvtailor.service.orchestration.event;

import com.phillippitts.cvtailor.domain.SessionState;

import java.time.Instant;

/**
 * Emitted after a generation run has reached a terminal state and been persisted.
 *
 * @param state          {@code COMPLETED} or {@code FAILED}
 * @param partialFailure a secondary document failed or the page target was missed
 * @param attempts       page-count attempts consumed, 0 when no primary content was produced
 * @param durationMs     wall time of the run
 */
public record GenerationCompletedEvent(
        String sessionId,
        String ownerId,
        SessionState state,
        boolean partialFailure,
        int attempts,
        long durationMs,
        Instant timestamp
) {}
