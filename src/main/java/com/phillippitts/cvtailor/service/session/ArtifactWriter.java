package com.phillippitts.cvtailor.service.session;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.service.storage.ContentStore;
import com.phillippitts.cvtailor.service.storage.StoragePaths;
import com.phillippitts.cvtailor.util.ArtifactNaming;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Writes generated documents under a session's {@code generated/} directory with descriptive
 * file names. Rewrites of an existing document keep its original path.
 */
@Component
public class ArtifactWriter {

    private final ContentStore store;
    private final Clock clock;

    public ArtifactWriter(ContentStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param existingPath current path of the document, or {@code null} to derive a new one
     * @return the path written
     */
    public String writeSource(Session session, DocumentType type, String content, String existingPath) {
        String path = existingPath != null ? existingPath : pathFor(session, type, type.extension());
        store.writeText(path, content);
        return path;
    }

    public String writeCompiled(Session session, byte[] pdf, String existingPath) {
        String path = existingPath != null ? existingPath : pathFor(session, DocumentType.CV, "pdf");
        store.write(path, pdf);
        return path;
    }

    private String pathFor(Session session, DocumentType type, String extension) {
        JobContext job = session.jobContext();
        String fileName = ArtifactNaming.fileName(
                LocalDate.now(clock),
                job == null ? JobContext.UNKNOWN_COMPANY : job.companyName(),
                job == null ? JobContext.UNKNOWN_TITLE : job.jobTitle(),
                session.ownerId(),
                type,
                extension);
        return StoragePaths.generated(session.ownerId(), session.id(), fileName);
    }
}
