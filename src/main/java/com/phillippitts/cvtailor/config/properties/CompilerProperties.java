package com.phillippitts.cvtailor.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * External tool locations for LaTeX compilation and PDF inspection.
 */
@Validated
@ConfigurationProperties(prefix = "generation.compiler")
public class CompilerProperties {

    @NotBlank
    private final String latexBinary;

    @NotBlank
    private final String pageInfoBinary;

    @NotBlank
    private final String textBinary;

    @NotNull
    private final Duration timeout;

    /**
     * Cap on captured stdout per tool invocation.
     */
    private final int maxOutputChars;

    @ConstructorBinding
    public CompilerProperties(String latexBinary, String pageInfoBinary, String textBinary,
                              Duration timeout, Integer maxOutputChars) {
        this.latexBinary = latexBinary == null ? "pdflatex" : latexBinary;
        this.pageInfoBinary = pageInfoBinary == null ? "pdfinfo" : pageInfoBinary;
        this.textBinary = textBinary == null ? "pdftotext" : textBinary;
        this.timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        this.maxOutputChars = maxOutputChars == null ? 1_048_576 : maxOutputChars;
    }

    public String getLatexBinary() {
        return latexBinary;
    }

    public String getPageInfoBinary() {
        return pageInfoBinary;
    }

    public String getTextBinary() {
        return textBinary;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxOutputChars() {
        return maxOutputChars;
    }
}
