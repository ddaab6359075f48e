package com.phillippitts.cvtailor.service.session;

/**
 * A stored document ready for download.
 */
public record ArtifactContent(String fileName, String mediaType, byte[] bytes) {
}
