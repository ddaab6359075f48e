package com.phillippitts.cvtailor.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits for fetching job postings by link.
 */
@Validated
@ConfigurationProperties(prefix = "generation.link")
public class LinkProperties {

    @NotNull
    private final Duration timeout;

    /**
     * Page text beyond this many characters is dropped before extraction.
     */
    @Min(1000)
    private final int maxChars;

    @ConstructorBinding
    public LinkProperties(Duration timeout, Integer maxChars) {
        this.timeout = timeout == null ? Duration.ofSeconds(20) : timeout;
        this.maxChars = maxChars == null ? 50_000 : maxChars;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxChars() {
        return maxChars;
    }
}
