package com.phillippitts.cvtailor.domain;

/**
 * Result of the page-count loop. Kept in memory only; the compiled bytes are written to the
 * content store by the orchestrator.
 *
 * @param success           whether the final page count equals the target
 * @param content           LaTeX source of the returned attempt
 * @param compiledArtifact  PDF bytes, or {@code null} when no attempt compiled
 * @param pageCount         page count of {@code compiledArtifact}, or {@code null}
 * @param attempts          attempts consumed
 * @param error             reason the target was missed, {@code null} on success
 */
public record PrimaryDocumentResult(
        boolean success,
        String content,
        byte[] compiledArtifact,
        Integer pageCount,
        int attempts,
        String error
) {
    public boolean hasCompiledArtifact() {
        return compiledArtifact != null;
    }
}
