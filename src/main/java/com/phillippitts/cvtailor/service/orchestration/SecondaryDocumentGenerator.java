package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.GenerationPrompt;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.context.SourceDocuments;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Single-shot generation of the cover letter and cold email from the tailored CV text.
 */
@Component
public class SecondaryDocumentGenerator {

    private final GenerationBackend backend;

    public SecondaryDocumentGenerator(GenerationBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    public String generate(DocumentType type, JobContext job, SourceDocuments sources, String cvText) {
        GenerationPrompt prompt;
        switch (type) {
            case COVER_LETTER:
                prompt = GenerationPrompt.of(PromptKind.COVER_LETTER)
                        .with("coverLetterStrategy", sources.coverLetterStrategy());
                break;
            case COLD_EMAIL:
                prompt = GenerationPrompt.of(PromptKind.COLD_EMAIL)
                        .with("coldEmailStrategy", sources.coldEmailStrategy())
                        .with("emailAddresses", job.emailAddresses().isEmpty()
                                ? "none found" : String.join(", ", job.emailAddresses()));
                break;
            default:
                throw new IllegalArgumentException("Not a secondary document: " + type);
        }
        prompt = prompt
                .with("jobTitle", job.jobTitle())
                .with("companyName", job.companyName())
                .with("jobDescription", job.jobDescription())
                .with("cvText", cvText);
        return backend.generate(prompt).trim();
    }
}
