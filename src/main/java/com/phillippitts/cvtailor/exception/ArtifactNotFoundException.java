package com.phillippitts.cvtailor.exception;

import com.phillippitts.cvtailor.domain.DocumentType;

/**
 * Thrown when a session has no stored document of the requested type.
 */
public class ArtifactNotFoundException extends CvTailorException {

    private final String sessionId;
    private final DocumentType documentType;

    public ArtifactNotFoundException(String sessionId, DocumentType documentType) {
        super("No " + documentType.wireName() + " stored for session " + sessionId);
        this.sessionId = sessionId;
        this.documentType = documentType;
    }

    public String getSessionId() {
        return sessionId;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }
}
