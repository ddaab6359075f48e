package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.GenerationResult;
import com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.exception.SessionLockedException;
import com.phillippitts.cvtailor.exception.SessionNotFoundException;
import com.phillippitts.cvtailor.exception.UpstreamFetchException;
import com.phillippitts.cvtailor.service.progress.ProgressLog;

/**
 * Runs one end-to-end generation: job context, primary CV, secondary documents, persistence.
 *
 * <p>Every run ends with exactly one terminal event on {@code progress}. Failures raised before
 * a session is claimed leave no persisted trace and are rethrown after the terminal error event.
 */
public interface GenerationOrchestrator {

    /**
     * @return the run result; {@code state} is {@code FAILED} when the primary CV could not be
     *         generated at all
     * @throws InputInvalidException                   for blank input or missing source CV
     * @throws SessionNotFoundException               for an unknown {@code sessionId}
     * @throws SessionLockedException                  when regenerating an approved session
     * @throws ConcurrentSessionModificationException when another run owns the session
     * @throws UpstreamFetchException                  when a job link cannot be fetched
     */
    GenerationResult run(GenerationRequest request, ProgressLog progress);
}
