package com.phillippitts.cvtailor.service.session;

import com.phillippitts.cvtailor.config.properties.GenerationProperties;
import com.phillippitts.cvtailor.domain.ArtifactRefs;
import com.phillippitts.cvtailor.domain.ChatMessage;
import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.PrimaryArtifact;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.exception.ArtifactNotFoundException;
import com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.exception.StorageException;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.GenerationPrompt;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.compiler.CompiledDocument;
import com.phillippitts.cvtailor.service.compiler.DocumentCompiler;
import com.phillippitts.cvtailor.service.compiler.LatexSource;
import com.phillippitts.cvtailor.service.orchestration.ScratchWorkspace;
import com.phillippitts.cvtailor.service.storage.ContentStore;
import com.phillippitts.cvtailor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * User-initiated changes to an idle session: refine, edit, delete and download documents.
 *
 * <p>Every mutating operation goes through {@link SessionStateMachine#mutate}, so approved
 * sessions and sessions owned by a running generation are rejected before anything is
 * written.
 */
@Service
public class SessionMutationService {

    private static final Logger LOG = LogManager.getLogger(SessionMutationService.class);

    static final String PDF_FORMAT = "pdf";

    private final SessionStateMachine stateMachine;
    private final SessionService sessionService;
    private final ContentStore store;
    private final ArtifactWriter artifactWriter;
    private final GenerationBackend backend;
    private final DocumentCompiler compiler;
    private final Clock clock;
    private final int targetPageCount;
    private final Path scratchRoot;

    @Autowired
    public SessionMutationService(SessionStateMachine stateMachine, SessionService sessionService,
                                  ContentStore store, ArtifactWriter artifactWriter,
                                  GenerationBackend backend, DocumentCompiler compiler,
                                  Clock clock, GenerationProperties properties) {
        this(stateMachine, sessionService, store, artifactWriter, backend, compiler, clock,
                properties.getTargetPageCount(), Path.of(properties.getScratchRoot()));
    }

    public SessionMutationService(SessionStateMachine stateMachine, SessionService sessionService,
                                  ContentStore store, ArtifactWriter artifactWriter,
                                  GenerationBackend backend, DocumentCompiler compiler,
                                  Clock clock, int targetPageCount, Path scratchRoot) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.artifactWriter = Objects.requireNonNull(artifactWriter, "artifactWriter must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.targetPageCount = targetPageCount;
        this.scratchRoot = Objects.requireNonNull(scratchRoot, "scratchRoot must not be null");
    }

    /**
     * Rewrites one document according to {@code feedback}. A refined CV is compiled once; if it
     * does not compile nothing is stored and the {@code CompileException} propagates.
     *
     * <p>The backend call and the compile run without holding the session lock. The result is
     * committed only if the session and the stored document are unchanged since they were read.
     *
     * @throws ConcurrentSessionModificationException if the session changed in the meantime
     */
    public RefinedDocument refineDocument(String ownerId, String sessionId, DocumentType type, String feedback) {
        Objects.requireNonNull(type, "type must not be null");
        if (feedback == null || feedback.isBlank()) {
            throw new InputInvalidException("feedback is required");
        }
        Session snapshot = sessionService.getSession(ownerId, sessionId);
        SessionStateMachine.requireMutable(snapshot);
        String path = requireSourcePath(snapshot, type);
        String current = store.readText(path)
                .orElseThrow(() -> new StorageException("Stored document is missing", path, null));

        String content = backend.generate(GenerationPrompt.of(PromptKind.REFINE)
                .with("documentType", type.wireName().replace('-', ' '))
                .with("feedback", feedback.trim())
                .with("currentContent", current)
                .with("jobDescription", snapshot.jobContext() == null ? "" : snapshot.jobContext().jobDescription()));

        RefinedDocument result;
        CompiledDocument compiled = null;
        if (type == DocumentType.CV) {
            content = LatexSource.clean(content);
            compiled = compileOnce(snapshot.id(), content);
            boolean targetMet = compiled.pageCount() == targetPageCount;
            result = new RefinedDocument(type, content, compiled.pageCount(), targetMet);
        } else {
            content = content.trim();
            result = new RefinedDocument(type, content, null, true);
        }

        CompiledDocument pdf = compiled;
        stateMachine.mutate(ownerId, sessionId, session -> {
            if (!session.equals(snapshot) || !store.readText(path).map(current::equals).orElse(false)) {
                throw new ConcurrentSessionModificationException(session.id(),
                        "Session changed while refining " + type.wireName() + ": " + session.id());
            }
            ArtifactRefs refs = session.artifacts();
            artifactWriter.writeSource(session, type, result.content(), path);
            if (pdf != null) {
                PrimaryArtifact cv = refs.cv();
                String pdfPath = artifactWriter.writeCompiled(session, pdf.bytes(), cv.compiledPath());
                refs = refs.withCv(new PrimaryArtifact(path, pdfPath, pdf.pageCount(), cv.attempts(),
                        result.targetMet()));
            }
            LOG.info("Refined {} of session {}", type.wireName(), session.id());
            return session.withArtifacts(refs, clock.instant())
                    .append(ChatMessage.user("Refine " + type.wireName() + ": "
                            + LogSanitizer.preview(feedback.trim(), LogSanitizer.PREVIEW_LENGTH), clock.instant()),
                            clock.instant())
                    .append(ChatMessage.assistant(refinementSummary(result), clock.instant()), clock.instant());
        });
        return result;
    }

    /**
     * Replaces the text of a cover letter or cold email with user-edited content.
     */
    public Session saveContent(String ownerId, String sessionId, DocumentType type, String content) {
        Objects.requireNonNull(type, "type must not be null");
        if (type == DocumentType.CV) {
            throw new InputInvalidException("the CV can only be changed through refinement");
        }
        if (content == null) {
            throw new InputInvalidException("content is required");
        }
        return stateMachine.mutate(ownerId, sessionId, session -> {
            String existing = session.artifacts().sourcePathFor(type).orElse(null);
            String path = artifactWriter.writeSource(session, type, content, existing);
            LOG.info("Saved edited {} of session {}", type.wireName(), session.id());
            return session.withArtifacts(session.artifacts().withSecondary(type, path), clock.instant());
        });
    }

    /**
     * Deletes a stored document and its reference. For the CV the source and PDF both go.
     * Deleting a document that is not stored changes nothing.
     */
    public Session deleteArtifact(String ownerId, String sessionId, DocumentType type) {
        Objects.requireNonNull(type, "type must not be null");
        return stateMachine.mutate(ownerId, sessionId, session -> {
            ArtifactRefs refs = session.artifacts();
            if (refs.sourcePathFor(type).isEmpty()) {
                return session;
            }
            refs.sourcePathFor(type).ifPresent(store::delete);
            if (type == DocumentType.CV && refs.cv().compiledPath() != null) {
                store.delete(refs.cv().compiledPath());
            }
            LOG.info("Deleted {} of session {}", type.wireName(), session.id());
            return session.withArtifacts(refs.without(type), clock.instant());
        });
    }

    /**
     * Reads a stored document. Allowed on locked sessions.
     *
     * @param format {@code "pdf"} for the compiled CV, anything else for the source
     */
    public ArtifactContent readArtifact(String ownerId, String sessionId, DocumentType type, String format) {
        Objects.requireNonNull(type, "type must not be null");
        Session session = sessionService.getSession(ownerId, sessionId);
        boolean pdf = PDF_FORMAT.equalsIgnoreCase(format);
        if (pdf && type != DocumentType.CV) {
            throw new InputInvalidException("only the CV has a PDF form");
        }
        String path = pdf
                ? (session.artifacts().cv() == null ? null : session.artifacts().cv().compiledPath())
                : session.artifacts().sourcePathFor(type).orElse(null);
        if (path == null) {
            throw new ArtifactNotFoundException(sessionId, type);
        }
        byte[] bytes = store.read(path).orElseThrow(() -> new ArtifactNotFoundException(sessionId, type));
        return new ArtifactContent(path.substring(path.lastIndexOf('/') + 1), mediaType(pdf, type), bytes);
    }

    private CompiledDocument compileOnce(String sessionId, String content) {
        try (ScratchWorkspace workspace = ScratchWorkspace.create(scratchRoot, "refine-" + sessionId)) {
            return compiler.compile(workspace.write("cv.tex", content));
        }
    }

    private static String requireSourcePath(Session session, DocumentType type) {
        return session.artifacts().sourcePathFor(type)
                .orElseThrow(() -> new ArtifactNotFoundException(session.id(), type));
    }

    private String refinementSummary(RefinedDocument result) {
        if (result.pageCount() == null) {
            return "Refined " + result.type().wireName().replace('-', ' ');
        }
        String summary = "Refined CV compiled to " + result.pageCount() + " pages";
        return result.targetMet() ? summary : summary + " (target is " + targetPageCount + ")";
    }

    private static String mediaType(boolean pdf, DocumentType type) {
        if (pdf) {
            return "application/pdf";
        }
        return type == DocumentType.CV ? "application/x-tex" : "text/plain;charset=UTF-8";
    }
}
