package com.phillippitts.cvtailor.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationMetricsTest {

    private MeterRegistry registry;
    private GenerationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GenerationMetrics(registry);
    }

    @Test
    void shouldRecordRunLatencyByOutcome() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(2500);

        metrics.recordRunLatency("completed", durationNanos);

        Timer timer = registry.find("cvtailor.generation.run.latency").tag("outcome", "completed").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountRunsPerOutcome() {
        metrics.incrementRun("partial");
        metrics.incrementRun("partial");
        metrics.incrementRun("failed");

        Counter partial = registry.find("cvtailor.generation.run").tag("outcome", "partial").counter();
        Counter failed = registry.find("cvtailor.generation.run").tag("outcome", "failed").counter();
        assertThat(partial.count()).isEqualTo(2.0);
        assertThat(failed.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordAttemptsTaggedByTargetMet() {
        metrics.recordAttempts(1, true);
        metrics.recordAttempts(3, false);

        DistributionSummary missed = registry.find("cvtailor.generation.primary.attempts")
                .tag("targetMet", "false").summary();
        assertThat(missed).isNotNull();
        assertThat(missed.totalAmount()).isEqualTo(3.0);
    }

    @Test
    void shouldCountSecondaryOutcomesAndFailures() {
        metrics.incrementSecondary("cover-letter", "generated");
        metrics.incrementFailure("UPSTREAM_FETCH_FAILED");

        assertThat(registry.find("cvtailor.generation.secondary")
                .tag("type", "cover-letter").tag("status", "generated").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("cvtailor.generation.failure")
                .tag("category", "UPSTREAM_FETCH_FAILED").counter().count()).isEqualTo(1.0);
    }
}
