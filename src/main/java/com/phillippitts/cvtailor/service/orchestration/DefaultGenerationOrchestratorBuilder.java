package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.compiler.TextExtractor;
import com.phillippitts.cvtailor.service.context.JobContextResolver;
import com.phillippitts.cvtailor.service.context.SourceDocumentLoader;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.session.ArtifactWriter;
import com.phillippitts.cvtailor.service.session.SessionService;
import com.phillippitts.cvtailor.service.session.SessionStateMachine;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Builder for {@link DefaultGenerationOrchestrator}.
 *
 * <pre>{@code
 * DefaultGenerationOrchestrator orchestrator = DefaultGenerationOrchestratorBuilder.builder()
 *     .sourceLoader(loader)
 *     .contextResolver(resolver)
 *     .sessionService(sessions)
 *     .stateMachine(stateMachine)
 *     .repository(repository)
 *     .progressChannel(channel)
 *     .retryLoop(loop)
 *     .secondaryGenerator(secondary)
 *     .artifactWriter(writer)
 *     .textExtractor(extractor)
 *     .backend(backend)
 *     .publisher(publisher)
 *     .scratchRoot(Path.of("/tmp/cv-tailor"))
 *     .build();
 * }</pre>
 *
 * <p>{@code metricsPublisher} defaults to {@link GenerationMetricsPublisher#NOOP} and
 * {@code clock} to UTC system time.
 */
public final class DefaultGenerationOrchestratorBuilder {

    SourceDocumentLoader sourceLoader;
    JobContextResolver contextResolver;
    SessionService sessionService;
    SessionStateMachine stateMachine;
    SessionRepository repository;
    ProgressChannel progressChannel;
    PageCountRetryLoop retryLoop;
    SecondaryDocumentGenerator secondaryGenerator;
    ArtifactWriter artifactWriter;
    TextExtractor textExtractor;
    GenerationBackend backend;
    ApplicationEventPublisher publisher;
    GenerationMetricsPublisher metricsPublisher = GenerationMetricsPublisher.NOOP;
    Clock clock = Clock.systemUTC();
    Path scratchRoot;

    private DefaultGenerationOrchestratorBuilder() {
    }

    public static DefaultGenerationOrchestratorBuilder builder() {
        return new DefaultGenerationOrchestratorBuilder();
    }

    public DefaultGenerationOrchestratorBuilder sourceLoader(SourceDocumentLoader sourceLoader) {
        this.sourceLoader = sourceLoader;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder contextResolver(JobContextResolver contextResolver) {
        this.contextResolver = contextResolver;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder sessionService(SessionService sessionService) {
        this.sessionService = sessionService;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder stateMachine(SessionStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder repository(SessionRepository repository) {
        this.repository = repository;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder progressChannel(ProgressChannel progressChannel) {
        this.progressChannel = progressChannel;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder retryLoop(PageCountRetryLoop retryLoop) {
        this.retryLoop = retryLoop;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder secondaryGenerator(SecondaryDocumentGenerator secondaryGenerator) {
        this.secondaryGenerator = secondaryGenerator;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder artifactWriter(ArtifactWriter artifactWriter) {
        this.artifactWriter = artifactWriter;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder textExtractor(TextExtractor textExtractor) {
        this.textExtractor = textExtractor;
        return this;
    }

    /**
     * Backend used for the change summary.
     */
    public DefaultGenerationOrchestratorBuilder backend(GenerationBackend backend) {
        this.backend = backend;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder metricsPublisher(GenerationMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public DefaultGenerationOrchestratorBuilder scratchRoot(Path scratchRoot) {
        this.scratchRoot = scratchRoot;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultGenerationOrchestrator build() {
        Objects.requireNonNull(sourceLoader, "sourceLoader is required");
        Objects.requireNonNull(contextResolver, "contextResolver is required");
        Objects.requireNonNull(sessionService, "sessionService is required");
        Objects.requireNonNull(stateMachine, "stateMachine is required");
        Objects.requireNonNull(repository, "repository is required");
        Objects.requireNonNull(progressChannel, "progressChannel is required");
        Objects.requireNonNull(retryLoop, "retryLoop is required");
        Objects.requireNonNull(secondaryGenerator, "secondaryGenerator is required");
        Objects.requireNonNull(artifactWriter, "artifactWriter is required");
        Objects.requireNonNull(textExtractor, "textExtractor is required");
        Objects.requireNonNull(backend, "backend is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(scratchRoot, "scratchRoot is required");
        return new DefaultGenerationOrchestrator(this);
    }
}
