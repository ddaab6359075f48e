package com.phillippitts.cvtailor.service.backend;

import com.phillippitts.cvtailor.exception.PermanentBackendException;
import com.phillippitts.cvtailor.exception.TransientBackendException;
import com.phillippitts.cvtailor.testutil.ScriptedGenerationBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingGenerationBackendTest {

    private final GenerationPrompt prompt = GenerationPrompt.of(PromptKind.COVER_LETTER);

    private ScriptedGenerationBackend delegate;
    private List<Duration> sleeps;
    private RetryingGenerationBackend backend;

    @BeforeEach
    void setUp() {
        delegate = new ScriptedGenerationBackend();
        sleeps = new ArrayList<>();
        backend = new RetryingGenerationBackend(delegate, 3, Duration.ofMillis(100), Duration.ofSeconds(1),
                sleeps::add);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldReturnFirstSuccessfulResponse() {
        delegate.respond(PromptKind.COVER_LETTER, "Dear Acme");

        assertThat(backend.generate(prompt)).isEqualTo("Dear Acme");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldAbsorbTransientFailures() {
        delegate.fail(PromptKind.COVER_LETTER, new TransientBackendException("rate limited", 429))
                .fail(PromptKind.COVER_LETTER, new TransientBackendException("overloaded", 529))
                .respond(PromptKind.COVER_LETTER, "Dear Acme");

        assertThat(backend.generate(prompt)).isEqualTo("Dear Acme");
        assertThat(delegate.calls(PromptKind.COVER_LETTER)).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void shouldConvertExhaustedRetriesIntoPermanentFailure() {
        for (int i = 0; i < 3; i++) {
            delegate.fail(PromptKind.COVER_LETTER, new TransientBackendException("rate limited", 429));
        }

        assertThatThrownBy(() -> backend.generate(prompt))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("after 3 attempts")
                .hasCauseInstanceOf(TransientBackendException.class)
                .satisfies(e -> assertThat(((PermanentBackendException) e).getAttempts()).isEqualTo(3));
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        delegate.fail(PromptKind.COVER_LETTER, new PermanentBackendException("invalid api key"));

        assertThatThrownBy(() -> backend.generate(prompt))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessage("invalid api key");
        assertThat(delegate.calls(PromptKind.COVER_LETTER)).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldGrowBackoffExponentiallyUpToCap() {
        assertThat(backend.backoff(1).toMillis()).isBetween(100L, 350L);
        assertThat(backend.backoff(2).toMillis()).isBetween(200L, 450L);
        assertThat(backend.backoff(3).toMillis()).isBetween(400L, 650L);
        assertThat(backend.backoff(10).toMillis()).isEqualTo(1000L);
    }

    @Test
    void shouldGiveUpWhenInterruptedDuringBackoff() {
        RetryingGenerationBackend interrupted = new RetryingGenerationBackend(delegate, 3,
                Duration.ofMillis(100), Duration.ofSeconds(1), d -> {
                    throw new InterruptedException();
                });
        delegate.fail(PromptKind.COVER_LETTER, new TransientBackendException("rate limited", 429));

        assertThatThrownBy(() -> interrupted.generate(prompt))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("Interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void shouldRejectNonPositiveAttempts() {
        assertThatThrownBy(() -> new RetryingGenerationBackend(delegate, 0, Duration.ZERO, Duration.ZERO, d -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
