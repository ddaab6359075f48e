package com.phillippitts.cvtailor.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for generation runs.
 *
 * <p>Provides:
 * <ul>
 *   <li>Run latency and count by outcome (completed, partial, failed)</li>
 *   <li>Page-count attempts per primary document, tagged by whether the target was met</li>
 *   <li>Secondary document outcomes by type</li>
 *   <li>Failures by category</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class GenerationMetrics {

    private static final String METRIC_PREFIX = "cvtailor.generation";

    private final MeterRegistry registry;

    public GenerationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunLatency(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".run.latency")
                .description("Wall time of a generation run")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementRun(String outcome) {
        Counter.builder(METRIC_PREFIX + ".run")
                .description("Number of finished generation runs")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAttempts(int attempts, boolean targetMet) {
        DistributionSummary.builder(METRIC_PREFIX + ".primary.attempts")
                .description("Page-count attempts consumed per CV")
                .tag("targetMet", String.valueOf(targetMet))
                .register(registry)
                .record(attempts);
    }

    public void incrementSecondary(String documentType, String status) {
        Counter.builder(METRIC_PREFIX + ".secondary")
                .description("Secondary document outcomes")
                .tag("type", documentType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String category) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Generation requests that ended in an error")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
