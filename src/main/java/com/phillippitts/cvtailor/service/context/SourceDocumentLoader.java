package com.phillippitts.cvtailor.service.context;

import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.service.storage.ContentStore;
import com.phillippitts.cvtailor.service.storage.StoragePaths;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Loads an owner's source documents from {@code users/{owner}/sources/}.
 */
@Component
public class SourceDocumentLoader {

    static final String ORIGINAL_CV = "original_cv.tex";
    static final String EXTENSIVE_CV = "extensive_cv.txt";
    static final String CV_STRATEGY = "cv_strategy.txt";
    static final String COVER_LETTER_STRATEGY = "cover_letter_strategy.txt";
    static final String COLD_EMAIL_STRATEGY = "cold_email_strategy.txt";

    private final ContentStore store;

    public SourceDocumentLoader(ContentStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * @throws InputInvalidException if the owner has not uploaded an original CV
     */
    public SourceDocuments load(String ownerId) {
        String originalCv = store.readText(StoragePaths.source(ownerId, ORIGINAL_CV))
                .filter(text -> !text.isBlank())
                .orElseThrow(() -> new InputInvalidException("no original CV uploaded for this user"));
        return new SourceDocuments(
                originalCv,
                optional(ownerId, EXTENSIVE_CV),
                optional(ownerId, CV_STRATEGY),
                optional(ownerId, COVER_LETTER_STRATEGY),
                optional(ownerId, COLD_EMAIL_STRATEGY));
    }

    private String optional(String ownerId, String fileName) {
        return store.readText(StoragePaths.source(ownerId, fileName)).orElse("");
    }
}
