package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.config.properties.GenerationProperties;
import com.phillippitts.cvtailor.domain.AttemptOutcome;
import com.phillippitts.cvtailor.domain.GenerationAttempt;
import com.phillippitts.cvtailor.domain.PrimaryDocumentResult;
import com.phillippitts.cvtailor.exception.CompileException;
import com.phillippitts.cvtailor.exception.GenerationBackendException;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.GenerationPrompt;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.compiler.CompiledDocument;
import com.phillippitts.cvtailor.service.compiler.DocumentCompiler;
import com.phillippitts.cvtailor.service.compiler.LatexSource;
import com.phillippitts.cvtailor.service.progress.ProgressReporter;
import com.phillippitts.cvtailor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Generate, compile, measure, and regenerate until the CV hits the target page count.
 *
 * <p>Attempt 1 uses the base prompt. Each later attempt uses a corrective prompt built from the
 * previous attempt only: its content plus either the measured page count or the compiler
 * diagnostics. Transient backend failures are absorbed by the backend and never consume an
 * attempt.
 *
 * <p>The loop stops early only on success. When attempts run out it returns a degraded result
 * holding the attempt whose page count was closest to the target (the later attempt wins ties),
 * or, if nothing compiled, the last generated content with no compiled artifact.
 *
 * <p>A permanent backend failure propagates on any attempt.
 */
@Component
public class PageCountRetryLoop {

    private static final Logger LOG = LogManager.getLogger(PageCountRetryLoop.class);

    static final String SOURCE_FILE = "cv.tex";
    private static final int LOG_DIAGNOSTIC_CHARS = 200;

    private final GenerationBackend backend;
    private final DocumentCompiler compiler;
    private final int targetPageCount;
    private final int maxAttempts;

    @Autowired
    public PageCountRetryLoop(GenerationBackend backend, DocumentCompiler compiler, GenerationProperties properties) {
        this(backend, compiler, properties.getTargetPageCount(), properties.getMaxAttempts());
    }

    public PageCountRetryLoop(GenerationBackend backend, DocumentCompiler compiler,
                              int targetPageCount, int maxAttempts) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        if (targetPageCount < 1) {
            throw new IllegalArgumentException("targetPageCount must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.targetPageCount = targetPageCount;
        this.maxAttempts = maxAttempts;
    }

    public int targetPageCount() {
        return targetPageCount;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param basePrompt     prompt for attempt 1
     * @param jobDescription carried into page-count corrections
     * @param workspace      scratch directory for the source and compiler output
     * @throws GenerationBackendException if the backend fails permanently
     */
    public PrimaryDocumentResult run(GenerationPrompt basePrompt, String jobDescription,
                                     ScratchWorkspace workspace, ProgressReporter progress) {
        Objects.requireNonNull(basePrompt, "basePrompt must not be null");
        Objects.requireNonNull(workspace, "workspace must not be null");
        Objects.requireNonNull(progress, "progress must not be null");

        GenerationAttempt previous = null;
        String previousContent = null;
        Candidate closest = null;
        String lastCompileError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            progress.info("CV attempt " + attempt + "/" + maxAttempts + ": generating...");
            GenerationPrompt prompt = attempt == 1
                    ? basePrompt
                    : correctivePrompt(previous, previousContent, jobDescription);

            String content = LatexSource.clean(backend.generate(prompt));
            previousContent = content;

            Path source = workspace.write(SOURCE_FILE, content);
            progress.info("CV attempt " + attempt + "/" + maxAttempts + ": compiling...");
            try {
                CompiledDocument document = compiler.compile(source);
                GenerationAttempt measured = GenerationAttempt.compiled(attempt, document.pageCount(), targetPageCount);
                if (measured.outcome() == AttemptOutcome.SUCCESS) {
                    progress.success("✓ CV compiled to " + targetPageCount + " pages on attempt " + attempt);
                    return new PrimaryDocumentResult(true, content, document.bytes(), document.pageCount(),
                            attempt, null);
                }
                progress.warn("Attempt " + attempt + " produced " + document.pageCount()
                        + " pages, need " + targetPageCount);
                closest = closer(closest, new Candidate(content, document));
                previous = measured;
            } catch (CompileException e) {
                String diagnostic = e.getDiagnostics().isBlank() ? e.getMessage() : e.getDiagnostics();
                progress.warn("Attempt " + attempt + " failed to compile: "
                        + LogSanitizer.preview(LogSanitizer.singleLine(diagnostic), LOG_DIAGNOSTIC_CHARS));
                lastCompileError = e.getMessage();
                previous = GenerationAttempt.compileError(attempt, diagnostic);
            }
        }

        String error = closest != null
                ? "Could not reach " + targetPageCount + " pages after " + maxAttempts
                        + " attempts; closest attempt has " + closest.document().pageCount() + " pages"
                : "No attempt compiled after " + maxAttempts + " attempts: " + lastCompileError;
        LOG.info("CV attempts exhausted: {}", error);
        progress.warn("⚠ " + error);
        return degraded(closest, previousContent, maxAttempts, error);
    }

    private GenerationPrompt correctivePrompt(GenerationAttempt previous, String previousContent,
                                              String jobDescription) {
        if (previous.outcome() == AttemptOutcome.COMPILE_ERROR) {
            return GenerationPrompt.of(PromptKind.FIX_COMPILE_ERROR)
                    .with("diagnostic", previous.diagnostic())
                    .with("targetPageCount", targetPageCount)
                    .with("previousContent", previousContent);
        }
        return GenerationPrompt.of(PromptKind.FIX_PAGE_COUNT)
                .with("previousPageCount", previous.pageCount())
                .with("targetPageCount", targetPageCount)
                .with("jobDescription", jobDescription)
                .with("previousContent", previousContent);
    }

    private Candidate closer(Candidate current, Candidate next) {
        if (current == null) {
            return next;
        }
        int currentDistance = Math.abs(current.document().pageCount() - targetPageCount);
        int nextDistance = Math.abs(next.document().pageCount() - targetPageCount);
        return nextDistance <= currentDistance ? next : current;
    }

    private static PrimaryDocumentResult degraded(Candidate closest, String lastContent, int attempts, String error) {
        if (closest != null) {
            return new PrimaryDocumentResult(false, closest.content(), closest.document().bytes(),
                    closest.document().pageCount(), attempts, error);
        }
        return new PrimaryDocumentResult(false, lastContent, null, null, attempts, error);
    }

    private record Candidate(String content, CompiledDocument document) {
    }
}
