package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.SecondaryStatus;
import com.phillippitts.cvtailor.service.metrics.GenerationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class GenerationMetricsPublisherTest {

    @Test
    void noopPublisherIgnoresEveryCall() {
        assertThat(GenerationMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> {
            GenerationMetricsPublisher.NOOP.recordRun("completed", 1L);
            GenerationMetricsPublisher.NOOP.recordPrimary(2, true);
            GenerationMetricsPublisher.NOOP.recordSecondary(DocumentType.COLD_EMAIL, SecondaryStatus.SKIPPED);
            GenerationMetricsPublisher.NOOP.recordFailure("INTERNAL_ERROR");
        }).doesNotThrowAnyException();
    }

    @Test
    void publisherForwardsToRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        GenerationMetricsPublisher publisher = new GenerationMetricsPublisher(new GenerationMetrics(registry));

        publisher.recordRun("completed", 1_000_000L);
        publisher.recordSecondary(DocumentType.COVER_LETTER, SecondaryStatus.FAILED);

        assertThat(publisher.isEnabled()).isTrue();
        assertThat(registry.find("cvtailor.generation.run").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("cvtailor.generation.secondary")
                .tag("type", "cover-letter").tag("status", "failed").counter()).isNotNull();
    }
}
