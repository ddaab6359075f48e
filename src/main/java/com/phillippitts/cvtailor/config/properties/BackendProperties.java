package com.phillippitts.cvtailor.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the HTTP text-generation backend and its transient-failure retry policy.
 */
@Validated
@ConfigurationProperties(prefix = "generation.backend")
public class BackendProperties {

    @NotBlank
    private final String endpoint;

    @NotBlank
    private final String model;

    /**
     * Bearer token; blank disables the Authorization header.
     */
    private final String apiKey;

    @NotNull
    private final Duration requestTimeout;

    @Valid
    private final Retry retry;

    @ConstructorBinding
    public BackendProperties(String endpoint, String model, String apiKey, Duration requestTimeout, Retry retry) {
        this.endpoint = endpoint == null ? "http://localhost:11434/api/generate" : endpoint;
        this.model = model == null ? "default" : model;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.requestTimeout = requestTimeout == null ? Duration.ofSeconds(120) : requestTimeout;
        this.retry = retry == null ? new Retry(null, null, null) : retry;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getModel() {
        return model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Retry getRetry() {
        return retry;
    }

    /**
     * Exponential backoff for rate limiting and overload: delay doubles from
     * {@code initialDelay} up to {@code maxDelay}.
     */
    public static class Retry {

        @Min(1)
        private final int maxAttempts;

        @NotNull
        private final Duration initialDelay;

        @NotNull
        private final Duration maxDelay;

        public Retry(Integer maxAttempts, Duration initialDelay, Duration maxDelay) {
            this.maxAttempts = maxAttempts == null ? 5 : maxAttempts;
            this.initialDelay = initialDelay == null ? Duration.ofSeconds(5) : initialDelay;
            this.maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }
    }
}
