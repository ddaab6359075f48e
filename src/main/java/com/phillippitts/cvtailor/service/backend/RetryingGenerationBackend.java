package com.phillippitts.cvtailor.service.backend;

import com.phillippitts.cvtailor.config.properties.BackendProperties;
import com.phillippitts.cvtailor.exception.PermanentBackendException;
import com.phillippitts.cvtailor.exception.TransientBackendException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decorator that absorbs {@link TransientBackendException}s with exponential backoff.
 *
 * <p>Callers only ever see a successful result or a {@link PermanentBackendException}; retries
 * here never count as page-count attempts. Delay for retry {@code n} is
 * {@code initialDelay * 2^(n-1)} plus up to 250ms jitter, capped at {@code maxDelay}.
 */
public final class RetryingGenerationBackend implements GenerationBackend {

    private static final Logger LOG = LogManager.getLogger(RetryingGenerationBackend.class);
    private static final long MAX_JITTER_MS = 250;

    /**
     * Sleep hook so tests can observe backoff without waiting.
     */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final GenerationBackend delegate;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryingGenerationBackend(GenerationBackend delegate, BackendProperties.Retry retry) {
        this(delegate, retry.getMaxAttempts(), retry.getInitialDelay(), retry.getMaxDelay(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    RetryingGenerationBackend(GenerationBackend delegate, int maxAttempts, Duration initialDelay,
                              Duration maxDelay, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public String generate(GenerationPrompt prompt) {
        TransientBackendException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return delegate.generate(prompt);
            } catch (TransientBackendException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoff(attempt);
                LOG.warn("Generation backend busy for {} ({}); retry {}/{} in {}ms",
                        prompt.kind(), e.getMessage(), attempt, maxAttempts - 1, delay.toMillis());
                pause(delay, e);
            }
        }
        throw new PermanentBackendException("Generation backend still unavailable after "
                + maxAttempts + " attempts: " + last.getMessage(), maxAttempts, last);
    }

    Duration backoff(int retry) {
        long base = initialDelay.toMillis() << Math.min(retry - 1, 20);
        long jitter = ThreadLocalRandom.current().nextLong(0, MAX_JITTER_MS + 1);
        return Duration.ofMillis(Math.min(maxDelay.toMillis(), base + jitter));
    }

    private void pause(Duration delay, TransientBackendException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PermanentBackendException("Interrupted while backing off from generation backend", cause);
        }
    }
}
