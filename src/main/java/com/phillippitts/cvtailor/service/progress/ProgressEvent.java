package com.phillippitts.cvtailor.service.progress;

import java.time.Instant;
import java.util.Objects;

/**
 * One event of a generation run.
 *
 * <p>Payload by kind: {@code LOG} carries a {@link com.phillippitts.cvtailor.domain.LogLine},
 * {@code SESSION} a {@link SessionAnnouncement}, {@code COMPLETE} a
 * {@link com.phillippitts.cvtailor.domain.GenerationResult} and {@code ERROR} a {@link ProgressError}.
 *
 * @param sequence zero-based, contiguous within one run
 */
public record ProgressEvent(long sequence, ProgressEventKind kind, Instant timestamp, Object payload) {

    public ProgressEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    public boolean terminal() {
        return kind == ProgressEventKind.COMPLETE
                || (kind == ProgressEventKind.ERROR && ((ProgressError) payload).terminal());
    }
}
