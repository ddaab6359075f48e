package com.phillippitts.cvtailor.domain;

import java.util.Objects;

/**
 * Outcome of one pass of the page-count loop.
 *
 * @param pageCount  compiled page count, {@code null} when compilation failed
 * @param diagnostic compiler diagnostics for {@link AttemptOutcome#COMPILE_ERROR}, otherwise empty
 */
public record GenerationAttempt(int index, AttemptOutcome outcome, Integer pageCount, String diagnostic) {

    public GenerationAttempt {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1");
        }
        Objects.requireNonNull(outcome, "outcome must not be null");
        diagnostic = diagnostic == null ? "" : diagnostic;
    }

    public static GenerationAttempt compiled(int index, int pageCount, int targetPageCount) {
        AttemptOutcome outcome = pageCount == targetPageCount ? AttemptOutcome.SUCCESS : AttemptOutcome.PAGE_MISMATCH;
        return new GenerationAttempt(index, outcome, pageCount, "");
    }

    public static GenerationAttempt compileError(int index, String diagnostic) {
        return new GenerationAttempt(index, AttemptOutcome.COMPILE_ERROR, null, diagnostic);
    }
}
