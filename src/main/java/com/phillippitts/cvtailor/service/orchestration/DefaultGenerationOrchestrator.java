package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.ArtifactRefs;
import com.phillippitts.cvtailor.domain.ChatMessage;
import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.GenerationPreferences;
import com.phillippitts.cvtailor.domain.GenerationResult;
import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.domain.PrimaryArtifact;
import com.phillippitts.cvtailor.domain.PrimaryDocumentResult;
import com.phillippitts.cvtailor.domain.PrimaryOutcome;
import com.phillippitts.cvtailor.domain.SecondaryOutcome;
import com.phillippitts.cvtailor.domain.SecondaryStatus;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.domain.SessionState;
import com.phillippitts.cvtailor.exception.CompileException;
import com.phillippitts.cvtailor.exception.CvTailorException;
import com.phillippitts.cvtailor.exception.ErrorCodes;
import com.phillippitts.cvtailor.exception.GenerationBackendException;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.GenerationPrompt;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.compiler.TextExtractor;
import com.phillippitts.cvtailor.service.context.JobContextResolver;
import com.phillippitts.cvtailor.service.context.SourceDocumentLoader;
import com.phillippitts.cvtailor.service.context.SourceDocuments;
import com.phillippitts.cvtailor.service.orchestration.event.GenerationCompletedEvent;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.progress.ProgressLog;
import com.phillippitts.cvtailor.service.session.ArtifactWriter;
import com.phillippitts.cvtailor.service.session.SessionService;
import com.phillippitts.cvtailor.service.session.SessionStateMachine;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import com.phillippitts.cvtailor.util.LogSanitizer;
import com.phillippitts.cvtailor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link GenerationOrchestrator}.
 *
 * <p>Run sequence:
 * <ol>
 *   <li>Validate input; for an existing session, reject it early if locked or busy</li>
 *   <li>Load source documents and resolve the job context (link fetch, extraction)</li>
 *   <li>Create the session in {@code PROCESSING}, or claim the existing one by compare-and-swap</li>
 *   <li>Announce the session and append the user message</li>
 *   <li>Run the page-count loop for the CV in a private scratch workspace</li>
 *   <li>Store the CV source and PDF, extract CV text, summarize changes</li>
 *   <li>Generate each enabled secondary document; failures are recorded, never fatal</li>
 *   <li>Write artifact refs, the assistant message and the terminal state in one update</li>
 *   <li>Persist the run log, emit {@code COMPLETE}, publish {@link GenerationCompletedEvent}</li>
 * </ol>
 *
 * <p>Failures in steps 1-3 leave nothing persisted. After step 3 every exit path moves the session
 * out of {@code PROCESSING}; the only path to {@code FAILED} without an exception is a permanent
 * backend failure before any CV content exists.
 */
public final class DefaultGenerationOrchestrator implements GenerationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultGenerationOrchestrator.class);

    static final String CHANGE_SUMMARY_FALLBACK = "Unable to generate change summary due to an error.";

    private final SourceDocumentLoader sourceLoader;
    private final JobContextResolver contextResolver;
    private final SessionService sessionService;
    private final SessionStateMachine stateMachine;
    private final SessionRepository repository;
    private final ProgressChannel progressChannel;
    private final PageCountRetryLoop retryLoop;
    private final SecondaryDocumentGenerator secondaryGenerator;
    private final ArtifactWriter artifactWriter;
    private final TextExtractor textExtractor;
    private final GenerationBackend backend;
    private final ApplicationEventPublisher publisher;
    private final GenerationMetricsPublisher metricsPublisher;
    private final Clock clock;
    private final Path scratchRoot;

    DefaultGenerationOrchestrator(DefaultGenerationOrchestratorBuilder builder) {
        this.sourceLoader = builder.sourceLoader;
        this.contextResolver = builder.contextResolver;
        this.sessionService = builder.sessionService;
        this.stateMachine = builder.stateMachine;
        this.repository = builder.repository;
        this.progressChannel = builder.progressChannel;
        this.retryLoop = builder.retryLoop;
        this.secondaryGenerator = builder.secondaryGenerator;
        this.artifactWriter = builder.artifactWriter;
        this.textExtractor = builder.textExtractor;
        this.backend = builder.backend;
        this.publisher = builder.publisher;
        this.metricsPublisher = builder.metricsPublisher;
        this.clock = builder.clock;
        this.scratchRoot = builder.scratchRoot;
    }

    @Override
    public GenerationResult run(GenerationRequest request, ProgressLog progress) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(progress, "progress must not be null");
        long start = System.nanoTime();

        Claim claim;
        try {
            claim = claimSession(request, progress);
        } catch (RuntimeException e) {
            rejectBeforeSession(e, progress);
            throw e;
        }

        Session session = claim.session();
        SourceDocuments sources = claim.sources();
        String sessionId = session.id();
        ThreadContext.put("sessionId", sessionId);
        GenerationResult result;
        try {
            progressChannel.bind(sessionId, progress);
            progress.announceSession(sessionId);
            session = stateMachine.updateRunOwned(request.ownerId(), sessionId,
                    s -> s.append(ChatMessage.user(userMessage(request.input(), s.jobContext()), clock.instant()),
                            clock.instant()));
            result = generateDocuments(session, sources, request.preferences(), progress);
        } catch (RuntimeException e) {
            LOG.error("Generation run for session {} failed unexpectedly", sessionId, e);
            abandonRun(session, progress, e);
            metricsPublisher.recordFailure(ErrorCodes.of(e));
            metricsPublisher.recordRun("failed", System.nanoTime() - start);
            throw e;
        } finally {
            progressChannel.release(sessionId, progress);
            ThreadContext.remove("sessionId");
        }

        long durationNanos = System.nanoTime() - start;
        metricsPublisher.recordRun(outcomeTag(result), durationNanos);
        int attempts = result.primary() == null ? 0 : result.primary().attempts();
        publisher.publishEvent(new GenerationCompletedEvent(sessionId, request.ownerId(), result.state(),
                result.partialFailure(), attempts, TimeUtils.nanosToMillis(durationNanos), clock.instant()));
        return result;
    }

    /**
     * Steps 1-3. Nothing is persisted until the final create or compare-and-swap.
     */
    private Claim claimSession(GenerationRequest request, ProgressLog progress) {
        if (request.input() == null || request.input().isBlank()) {
            throw new InputInvalidException("job description or link is required");
        }
        String ownerId = request.ownerId();
        if (request.sessionId() != null) {
            SessionStateMachine.requireMutable(sessionService.getSession(ownerId, request.sessionId()));
        }
        SourceDocuments sources = sourceLoader.load(ownerId);

        progress.info("Starting generation...");
        JobContext job = contextResolver.resolve(request.input(), progress);

        if (request.sessionId() == null) {
            return new Claim(stateMachine.create(ownerId, job), sources);
        }
        progress.info("Regenerating documents for existing session");
        return new Claim(stateMachine.beginProcessing(ownerId, request.sessionId(), job), sources);
    }

    private GenerationResult generateDocuments(Session session, SourceDocuments sources,
                                               GenerationPreferences preferences, ProgressLog progress) {
        JobContext job = session.jobContext();
        PrimaryDocumentResult primary;
        ArtifactRefs refs = ArtifactRefs.EMPTY;
        String changeSummary;
        String cvText;

        try (ScratchWorkspace workspace = ScratchWorkspace.create(scratchRoot, session.id())) {
            progress.info("Generating tailored CV (target " + retryLoop.targetPageCount() + " pages)...");
            try {
                primary = retryLoop.run(cvPrompt(sources, job), job.jobDescription(), workspace, progress);
            } catch (GenerationBackendException e) {
                return failPrimary(session, progress, e);
            }
            metricsPublisher.recordPrimary(primary.attempts(), primary.success());

            String sourcePath = artifactWriter.writeSource(session, DocumentType.CV, primary.content(), null);
            String pdfPath = primary.hasCompiledArtifact()
                    ? artifactWriter.writeCompiled(session, primary.compiledArtifact(), null)
                    : null;
            refs = refs.withCv(new PrimaryArtifact(sourcePath, pdfPath, primary.pageCount(),
                    primary.attempts(), primary.success()));
            progress.info("CV saved" + (pdfPath == null ? " (LaTeX source only, no PDF)" : ""));

            cvText = extractCvText(primary, progress);
            changeSummary = primary.success()
                    ? summarizeChanges(sources.originalCv(), primary.content(), job, progress)
                    : null;
        }

        Map<DocumentType, SecondaryOutcome> secondaries = new EnumMap<>(DocumentType.class);
        for (DocumentType type : DocumentType.secondaries()) {
            SecondaryOutcome outcome = preferences.enabled(type)
                    ? generateSecondary(session, type, job, sources, cvText, progress)
                    : skipSecondary(type, progress);
            secondaries.put(type, outcome);
            if (outcome.status() == SecondaryStatus.GENERATED) {
                refs = refs.withSecondary(type, outcome.path());
            }
        }

        boolean secondaryFailed = secondaries.values().stream()
                .anyMatch(outcome -> outcome.status() == SecondaryStatus.FAILED);
        PrimaryOutcome primaryOutcome = new PrimaryOutcome(primary.success(), primary.pageCount(),
                primary.attempts(), primary.error(), changeSummary,
                refs.cv().sourcePath(), refs.cv().compiledPath());
        GenerationResult result = new GenerationResult(session.id(), SessionState.COMPLETED, job,
                primaryOutcome, secondaries, !primary.success() || secondaryFailed, null);

        if (result.partialFailure()) {
            progress.warn("⚠ Generation complete with issues");
        } else {
            progress.success("✓ Generation complete");
        }
        List<LogLine> logs = progress.lines();
        ArtifactRefs finalRefs = refs;
        stateMachine.finish(session.ownerId(), session.id(), SessionState.COMPLETED,
                s -> s.withArtifacts(finalRefs, clock.instant())
                        .append(ChatMessage.assistant(assistantSummary(result), clock.instant(), result, logs),
                                clock.instant()));
        repository.saveLog(session.ownerId(), session.id(), logs);
        progress.complete(result);
        return result;
    }

    private GenerationResult failPrimary(Session session, ProgressLog progress, GenerationBackendException e) {
        LOG.warn("CV generation failed for session {}: {}", session.id(), e.getMessage());
        progress.error("✗ CV generation failed: " + e.getMessage());
        GenerationResult result = GenerationResult.failed(session.id(), session.jobContext(), e.getMessage());
        List<LogLine> logs = progress.lines();
        stateMachine.finish(session.ownerId(), session.id(), SessionState.FAILED,
                s -> s.append(ChatMessage.assistant("Generation failed: " + e.getMessage(), clock.instant(),
                        result, logs), clock.instant()));
        repository.saveLog(session.ownerId(), session.id(), logs);
        metricsPublisher.recordFailure(ErrorCodes.of(e));
        progress.fail(ErrorCodes.of(e), e.getMessage());
        return result;
    }

    private String extractCvText(PrimaryDocumentResult primary, ProgressLog progress) {
        if (!primary.hasCompiledArtifact()) {
            return primary.content();
        }
        try {
            return textExtractor.extractText(primary.compiledArtifact());
        } catch (CompileException e) {
            LOG.warn("CV text extraction failed, using LaTeX source: {}", e.getMessage());
            progress.warn("Could not extract CV text; using LaTeX source for follow-up documents");
            return primary.content();
        }
    }

    private String summarizeChanges(String originalCv, String tailoredCv, JobContext job, ProgressLog progress) {
        progress.info("Summarizing CV changes...");
        try {
            return backend.generate(GenerationPrompt.of(PromptKind.CV_CHANGE_SUMMARY)
                    .with("originalCv", originalCv)
                    .with("tailoredCv", tailoredCv)
                    .with("jobDescription", job.jobDescription())).trim();
        } catch (GenerationBackendException e) {
            LOG.warn("Change summary failed: {}", e.getMessage());
            progress.warn("Could not summarize CV changes");
            return CHANGE_SUMMARY_FALLBACK;
        }
    }

    private SecondaryOutcome generateSecondary(Session session, DocumentType type, JobContext job,
                                               SourceDocuments sources, String cvText, ProgressLog progress) {
        String label = label(type);
        progress.info("Generating " + label + "...");
        try {
            String content = secondaryGenerator.generate(type, job, sources, cvText);
            String path = artifactWriter.writeSource(session, type, content, null);
            progress.success("✓ " + capitalize(label) + " generated");
            metricsPublisher.recordSecondary(type, SecondaryStatus.GENERATED);
            return SecondaryOutcome.generated(type, content, path);
        } catch (CvTailorException e) {
            LOG.warn("{} generation failed: {}", label, e.getMessage());
            return failSecondary(type, label, e, progress);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error generating {}", label, e);
            return failSecondary(type, label, e, progress);
        }
    }

    private SecondaryOutcome failSecondary(DocumentType type, String label, RuntimeException e, ProgressLog progress) {
        String message = capitalize(label) + " failed: " + e.getMessage();
        progress.error("✗ " + message);
        progress.advisory(ErrorCodes.of(e), message);
        metricsPublisher.recordSecondary(type, SecondaryStatus.FAILED);
        return SecondaryOutcome.failed(type, e.getMessage());
    }

    private SecondaryOutcome skipSecondary(DocumentType type, ProgressLog progress) {
        progress.info(capitalize(label(type)) + " skipped (disabled in preferences)");
        metricsPublisher.recordSecondary(type, SecondaryStatus.SKIPPED);
        return SecondaryOutcome.skipped(type);
    }

    /**
     * Moves a claimed session to {@code FAILED} after an unexpected error. Errors while recording
     * the failure are attached to {@code cause} as suppressed.
     */
    private void abandonRun(Session session, ProgressLog progress, RuntimeException cause) {
        if (progress.isClosed()) {
            return;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        try {
            progress.error("✗ Generation failed: " + message);
            GenerationResult result = GenerationResult.failed(session.id(), session.jobContext(), message);
            List<LogLine> logs = progress.lines();
            stateMachine.finish(session.ownerId(), session.id(), SessionState.FAILED,
                    s -> s.append(ChatMessage.assistant("Generation failed: " + message, clock.instant(),
                            result, logs), clock.instant()));
            repository.saveLog(session.ownerId(), session.id(), logs);
        } catch (RuntimeException recordFailure) {
            LOG.error("Could not record failure of session {}", session.id(), recordFailure);
            cause.addSuppressed(recordFailure);
        } finally {
            progress.fail(ErrorCodes.of(cause), message);
        }
    }

    private void rejectBeforeSession(RuntimeException e, ProgressLog progress) {
        if (e instanceof CvTailorException) {
            LOG.warn("Generation request rejected: {}", e.getMessage());
        } else {
            LOG.error("Generation request failed before a session existed", e);
        }
        metricsPublisher.recordFailure(ErrorCodes.of(e));
        if (!progress.isClosed()) {
            progress.error("✗ " + e.getMessage());
            progress.fail(ErrorCodes.of(e), e.getMessage());
        }
    }

    private GenerationPrompt cvPrompt(SourceDocuments sources, JobContext job) {
        return GenerationPrompt.of(PromptKind.GENERATE_CV)
                .with("targetPageCount", retryLoop.targetPageCount())
                .with("cvStrategy", sources.cvStrategy())
                .with("jobDescription", job.jobDescription())
                .with("originalCv", sources.originalCv())
                .with("extensiveCv", sources.extensiveCv());
    }

    /**
     * The raw input; link inputs also keep a preview of the description extracted from the page.
     */
    private static String userMessage(String input, JobContext job) {
        String message = input.trim();
        if (job != null && job.sourceUrl() != null) {
            message += "\n\nExtracted job description:\n"
                    + LogSanitizer.preview(job.jobDescription(), LogSanitizer.PREVIEW_LENGTH);
        }
        return message;
    }

    private static String assistantSummary(GenerationResult result) {
        PrimaryOutcome primary = result.primary();
        StringBuilder sb = new StringBuilder();
        sb.append("Generated CV for ").append(result.job().jobTitle())
                .append(" at ").append(result.job().companyName());
        if (primary.pageCount() != null) {
            sb.append(" (").append(primary.pageCount()).append(" pages, ")
                    .append(primary.attempts()).append(primary.attempts() == 1 ? " attempt)" : " attempts)");
        }
        if (!primary.success()) {
            sb.append("\n⚠ ").append(primary.error());
        }
        for (SecondaryOutcome outcome : result.secondaries().values()) {
            sb.append("\n").append(capitalize(label(outcome.type()))).append(": ")
                    .append(outcome.status().name().toLowerCase());
            if (outcome.error() != null) {
                sb.append(" (").append(outcome.error()).append(")");
            }
        }
        if (primary.changeSummary() != null) {
            sb.append("\n\nChanges:\n").append(primary.changeSummary());
        }
        return sb.toString();
    }

    private static String outcomeTag(GenerationResult result) {
        if (result.state() == SessionState.FAILED) {
            return "failed";
        }
        return result.partialFailure() ? "partial" : "completed";
    }

    private static String label(DocumentType type) {
        return type.wireName().replace('-', ' ');
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private record Claim(Session session, SourceDocuments sources) {
    }
}
