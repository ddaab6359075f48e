package com.phillippitts.cvtailor.domain;

import java.time.Instant;

/**
 * History list entry.
 */
public record SessionSummary(
        String id,
        String companyName,
        String jobTitle,
        SessionState state,
        boolean locked,
        Instant createdAt,
        Instant updatedAt
) {
    public static SessionSummary of(Session session) {
        JobContext job = session.jobContext();
        return new SessionSummary(session.id(),
                job == null ? JobContext.UNKNOWN_COMPANY : job.companyName(),
                job == null ? JobContext.UNKNOWN_TITLE : job.jobTitle(),
                session.state(), session.locked(), session.createdAt(), session.updatedAt());
    }
}
