package com.phillippitts.cvtailor.service.session;

import com.phillippitts.cvtailor.domain.DocumentType;

/**
 * Outcome of a refinement.
 *
 * @param pageCount pages of the recompiled CV; {@code null} for secondary documents
 * @param targetMet whether a refined CV still meets the page target; always true for secondary documents
 */
public record RefinedDocument(DocumentType type, String content, Integer pageCount, boolean targetMet) {
}
