package com.phillippitts.cvtailor.domain;

import com.phillippitts.cvtailor.exception.InputInvalidException;

import java.util.List;

/**
 * Documents produced by a generation run.
 *
 * <p>{@link #CV} is the primary, page-constrained document. The others are secondary:
 * generated once, never retried, and never able to fail the run.
 */
public enum DocumentType {
    CV("cv", "CV", "tex"),
    COVER_LETTER("cover-letter", "CoverLetter", "txt"),
    COLD_EMAIL("cold-email", "ColdEmail", "txt");

    private final String wireName;
    private final String fileLabel;
    private final String extension;

    DocumentType(String wireName, String fileLabel, String extension) {
        this.wireName = wireName;
        this.fileLabel = fileLabel;
        this.extension = extension;
    }

    public String wireName() {
        return wireName;
    }

    public String fileLabel() {
        return fileLabel;
    }

    public String extension() {
        return extension;
    }

    public boolean primary() {
        return this == CV;
    }

    public static List<DocumentType> secondaries() {
        return List.of(COVER_LETTER, COLD_EMAIL);
    }

    /**
     * Resolves the path segment used by the REST surface ({@code cv}, {@code cover-letter},
     * {@code cold-email}).
     *
     * @throws InputInvalidException for unknown names
     */
    public static DocumentType fromWireName(String name) {
        for (DocumentType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new InputInvalidException("unknown document type '" + name + "'");
    }
}
