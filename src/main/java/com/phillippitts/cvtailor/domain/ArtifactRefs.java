package com.phillippitts.cvtailor.domain;

import java.util.Optional;

/**
 * Content-store paths of a session's generated documents. Absent documents are {@code null}.
 */
public record ArtifactRefs(PrimaryArtifact cv, String coverLetterPath, String coldEmailPath) {

    public static final ArtifactRefs EMPTY = new ArtifactRefs(null, null, null);

    public ArtifactRefs withCv(PrimaryArtifact artifact) {
        return new ArtifactRefs(artifact, coverLetterPath, coldEmailPath);
    }

    public ArtifactRefs withSecondary(DocumentType type, String path) {
        switch (type) {
            case COVER_LETTER:
                return new ArtifactRefs(cv, path, coldEmailPath);
            case COLD_EMAIL:
                return new ArtifactRefs(cv, coverLetterPath, path);
            default:
                throw new IllegalArgumentException("Not a secondary document: " + type);
        }
    }

    /**
     * Drops the reference for the given document. For the CV both source and PDF are dropped.
     */
    public ArtifactRefs without(DocumentType type) {
        if (type == DocumentType.CV) {
            return new ArtifactRefs(null, coverLetterPath, coldEmailPath);
        }
        return withSecondary(type, null);
    }

    /**
     * Source path of the given document (LaTeX source for the CV).
     */
    public Optional<String> sourcePathFor(DocumentType type) {
        switch (type) {
            case CV:
                return Optional.ofNullable(cv).map(PrimaryArtifact::sourcePath);
            case COVER_LETTER:
                return Optional.ofNullable(coverLetterPath);
            case COLD_EMAIL:
                return Optional.ofNullable(coldEmailPath);
            default:
                return Optional.empty();
        }
    }
}
