package com.phillippitts.cvtailor.service.orchestration;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.compiler.TextExtractor;
import com.phillippitts.cvtailor.service.context.JobContextResolver;
import com.phillippitts.cvtailor.service.context.SourceDocumentLoader;
import com.phillippitts.cvtailor.service.link.LinkResolver;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.session.ArtifactWriter;
import com.phillippitts.cvtailor.service.session.SessionService;
import com.phillippitts.cvtailor.service.session.SessionStateMachine;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import com.phillippitts.cvtailor.service.storage.StoragePaths;
import com.phillippitts.cvtailor.testutil.EventCapturingPublisher;
import com.phillippitts.cvtailor.testutil.InMemoryContentStore;
import com.phillippitts.cvtailor.testutil.ScriptedCompiler;
import com.phillippitts.cvtailor.testutil.ScriptedGenerationBackend;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fully wired orchestration stack over in-memory storage and scripted collaborators.
 *
 * <p>Defaults: owner {@code alice} has an original CV; the backend extracts "Engineer at Acme"
 * and answers every generation prompt; the compiler must be scripted per test.
 */
final class OrchestrationTestDoubles {

    static final String OWNER = "alice";
    static final String ORIGINAL_CV = "\\documentclass{article}\\begin{document}Original\\end{document}";
    static final String TAILORED_CV = "\\documentclass{article}\\begin{document}Tailored\\end{document}";
    static final String DETAILS_JSON =
            "{\"companyName\":\"Acme\",\"jobTitle\":\"Engineer\",\"emailAddresses\":[\"jobs@acme.com\"]}";
    static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");

    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final InMemoryContentStore store = new InMemoryContentStore();
    final SessionRepository repository = new SessionRepository(store, JsonMapper.builder().findAndAddModules().build());
    final ProgressChannel channel = new ProgressChannel(clock);
    final SessionStateMachine stateMachine = new SessionStateMachine(repository, clock);
    final SessionService sessionService = new SessionService(repository, channel);
    final ScriptedGenerationBackend backend = new ScriptedGenerationBackend();
    final ScriptedCompiler compiler = new ScriptedCompiler();
    final AtomicReference<String> pageText = new AtomicReference<>("Job page text");
    final AtomicReference<RuntimeException> linkFailure = new AtomicReference<>();
    final LinkResolver linkResolver = url -> {
        RuntimeException failure = linkFailure.get();
        if (failure != null) {
            throw failure;
        }
        return pageText.get();
    };
    final AtomicReference<RuntimeException> extractorFailure = new AtomicReference<>();
    final TextExtractor textExtractor = bytes -> {
        RuntimeException failure = extractorFailure.get();
        if (failure != null) {
            throw failure;
        }
        return "CV TEXT";
    };
    final EventCapturingPublisher publisher = new EventCapturingPublisher();
    final PageCountRetryLoop retryLoop = new PageCountRetryLoop(backend, compiler, 2, 3);
    final ArtifactWriter artifactWriter = new ArtifactWriter(store, clock);
    final Path scratchRoot;
    final DefaultGenerationOrchestrator orchestrator;

    OrchestrationTestDoubles(Path scratchRoot) {
        this.scratchRoot = scratchRoot;
        store.writeText(StoragePaths.source(OWNER, "original_cv.tex"), ORIGINAL_CV);
        store.writeText(StoragePaths.source(OWNER, "cv_strategy.txt"), "Lead with impact");
        backend.always(PromptKind.EXTRACT_JOB_DETAILS, DETAILS_JSON)
                .always(PromptKind.EXTRACT_JOB_DESCRIPTION, "Engineer at Acme. Build things.")
                .always(PromptKind.GENERATE_CV, TAILORED_CV)
                .always(PromptKind.FIX_PAGE_COUNT, TAILORED_CV)
                .always(PromptKind.FIX_COMPILE_ERROR, TAILORED_CV)
                .always(PromptKind.CV_CHANGE_SUMMARY, "Moved projects up")
                .always(PromptKind.COVER_LETTER, "Dear Acme")
                .always(PromptKind.COLD_EMAIL, "Hi Acme")
                .always(PromptKind.REFINE, "Refined text");
        orchestrator = DefaultGenerationOrchestratorBuilder.builder()
                .sourceLoader(new SourceDocumentLoader(store))
                .contextResolver(new JobContextResolver(linkResolver, backend))
                .sessionService(sessionService)
                .stateMachine(stateMachine)
                .repository(repository)
                .progressChannel(channel)
                .retryLoop(retryLoop)
                .secondaryGenerator(new SecondaryDocumentGenerator(backend))
                .artifactWriter(artifactWriter)
                .textExtractor(textExtractor)
                .backend(backend)
                .publisher(publisher)
                .clock(clock)
                .scratchRoot(scratchRoot)
                .build();
    }
}
