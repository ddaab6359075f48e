package com.phillippitts.cvtailor.domain;

/**
 * Stored references for the primary document.
 *
 * @param sourcePath   content-store path of the LaTeX source
 * @param compiledPath content-store path of the PDF, or {@code null} if no attempt compiled
 * @param pageCount    page count of the stored PDF, or {@code null}
 * @param attempts     attempts consumed by the run that produced it
 * @param targetMet    whether the page constraint was satisfied
 */
public record PrimaryArtifact(
        String sourcePath,
        String compiledPath,
        Integer pageCount,
        int attempts,
        boolean targetMet
) {
}
