package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.SecondaryStatus;
import com.phillippitts.cvtailor.service.metrics.GenerationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Null-safe facade over {@link GenerationMetrics} for the orchestrator.
 *
 * <p>Every method is a no-op when constructed without metrics, so orchestration code and tests
 * never branch on whether a registry exists.
 *
 * @see DefaultGenerationOrchestrator
 */
public final class GenerationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(GenerationMetricsPublisher.class);

    /**
     * Shared no-op instance.
     */
    public static final GenerationMetricsPublisher NOOP = new GenerationMetricsPublisher(null);

    private final GenerationMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public GenerationMetricsPublisher(GenerationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("GenerationMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * @param outcome {@code completed}, {@code partial} or {@code failed}
     */
    public void recordRun(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordRunLatency(outcome, durationNanos);
        metrics.incrementRun(outcome);
    }

    public void recordPrimary(int attempts, boolean targetMet) {
        if (metrics == null) {
            return;
        }
        metrics.recordAttempts(attempts, targetMet);
    }

    public void recordSecondary(DocumentType type, SecondaryStatus status) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSecondary(type.wireName(), status.name().toLowerCase(Locale.ROOT));
    }

    /**
     * @param errorCategory e.g. {@code UPSTREAM_FETCH_FAILED}, {@code INTERNAL_ERROR}
     */
    public void recordFailure(String errorCategory) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(errorCategory);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
