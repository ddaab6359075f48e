package com.phillippitts.cvtailor.service.progress;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of in-flight progress logs keyed by session id, backing the pull path while a run
 * is active. Once a run's log is persisted it is released and readers fall back to storage.
 */
@Component
public class ProgressChannel {

    private final Clock clock;
    private final Map<String, ProgressLog> active = new ConcurrentHashMap<>();

    public ProgressChannel(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ProgressLog open() {
        return new ProgressLog(clock);
    }

    /**
     * Makes {@code log} the live log of {@code sessionId}, replacing any previous run's log.
     */
    public void bind(String sessionId, ProgressLog log) {
        active.put(sessionId, log);
    }

    public Optional<ProgressLog> active(String sessionId) {
        return Optional.ofNullable(active.get(sessionId));
    }

    /**
     * Removes the binding only if it still points at {@code log}.
     */
    public void release(String sessionId, ProgressLog log) {
        active.remove(sessionId, log);
    }
}
