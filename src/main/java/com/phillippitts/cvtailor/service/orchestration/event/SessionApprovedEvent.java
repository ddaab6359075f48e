package com.phillippitts.cvtailor.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted once per session, when it is first approved and locked.
 */
public record SessionApprovedEvent(String sessionId, String ownerId, Instant timestamp) {}
