package com.phillippitts.cvtailor.service.events;

import com.phillippitts.cvtailor.domain.SessionState;
import com.phillippitts.cvtailor.service.orchestration.event.GenerationCompletedEvent;
import com.phillippitts.cvtailor.service.orchestration.event.SessionApprovedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audit log of finished runs and approvals, written on the {@code eventExecutor} pool.
 * Degraded-run warnings are throttled per owner.
 */
@Component
class GenerationEventsListener {
    private static final Logger LOG = LogManager.getLogger(GenerationEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private final Map<String, Instant> lastWarning = new ConcurrentHashMap<>();

    @Async("eventExecutor")
    @EventListener
    public void onGenerationCompleted(GenerationCompletedEvent e) {
        if (e.state() == SessionState.FAILED) {
            LOG.warn("Generation failed: session={}, owner={}, durationMs={}",
                    e.sessionId(), e.ownerId(), e.durationMs());
            return;
        }
        LOG.info("Generation finished: session={}, owner={}, attempts={}, partialFailure={}, durationMs={}",
                e.sessionId(), e.ownerId(), e.attempts(), e.partialFailure(), e.durationMs());
        if (e.partialFailure() && shouldWarn("partial-" + e.ownerId())) {
            LOG.warn("Generation for {} completed with issues; check the session log of {}",
                    e.ownerId(), e.sessionId());
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onSessionApproved(SessionApprovedEvent e) {
        LOG.info("Session approved: session={}, owner={}", e.sessionId(), e.ownerId());
    }

    // Package-private for tests
    boolean shouldWarn(String key) {
        Instant now = Instant.now();
        Instant prev = lastWarning.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastWarning.put(key, now);
            return true;
        }
        return false;
    }
}
