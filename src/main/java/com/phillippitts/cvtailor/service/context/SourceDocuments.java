package com.phillippitts.cvtailor.service.context;

import java.util.Objects;

/**
 * The owner's uploaded inputs for tailoring. Only the original CV is required.
 */
public record SourceDocuments(
        String originalCv,
        String extensiveCv,
        String cvStrategy,
        String coverLetterStrategy,
        String coldEmailStrategy
) {
    public SourceDocuments {
        Objects.requireNonNull(originalCv, "originalCv must not be null");
        extensiveCv = extensiveCv == null ? "" : extensiveCv;
        cvStrategy = cvStrategy == null ? "" : cvStrategy;
        coverLetterStrategy = coverLetterStrategy == null ? "" : coverLetterStrategy;
        coldEmailStrategy = coldEmailStrategy == null ? "" : coldEmailStrategy;
    }
}
