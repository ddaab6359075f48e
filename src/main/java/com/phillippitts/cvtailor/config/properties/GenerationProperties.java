package com.phillippitts.cvtailor.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the generation loop.
 */
@Validated
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {

    /**
     * Page count the primary CV must compile to.
     */
    @Min(1)
    private final int targetPageCount;

    /**
     * Generate-compile-measure passes before accepting a degraded result.
     */
    @Min(1)
    private final int maxAttempts;

    /**
     * Parent directory for per-run scratch workspaces.
     */
    @NotBlank
    private final String scratchRoot;

    @ConstructorBinding
    public GenerationProperties(Integer targetPageCount, Integer maxAttempts, String scratchRoot) {
        this.targetPageCount = targetPageCount == null ? 2 : targetPageCount;
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.scratchRoot = scratchRoot == null || scratchRoot.isBlank()
                ? System.getProperty("java.io.tmpdir") : scratchRoot;
    }

    public int getTargetPageCount() {
        return targetPageCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getScratchRoot() {
        return scratchRoot;
    }
}
