package com.phillippitts.cvtailor.config.orchestration;

import com.phillippitts.cvtailor.config.properties.BackendProperties;
import com.phillippitts.cvtailor.config.properties.GenerationProperties;
import com.phillippitts.cvtailor.config.properties.LinkProperties;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.HttpGenerationBackend;
import com.phillippitts.cvtailor.service.backend.RetryingGenerationBackend;
import com.phillippitts.cvtailor.service.compiler.TextExtractor;
import com.phillippitts.cvtailor.service.context.JobContextResolver;
import com.phillippitts.cvtailor.service.context.SourceDocumentLoader;
import com.phillippitts.cvtailor.service.link.HttpLinkResolver;
import com.phillippitts.cvtailor.service.link.LinkResolver;
import com.phillippitts.cvtailor.service.metrics.GenerationMetrics;
import com.phillippitts.cvtailor.service.orchestration.DefaultGenerationOrchestratorBuilder;
import com.phillippitts.cvtailor.service.orchestration.GenerationMetricsPublisher;
import com.phillippitts.cvtailor.service.orchestration.GenerationOrchestrator;
import com.phillippitts.cvtailor.service.orchestration.PageCountRetryLoop;
import com.phillippitts.cvtailor.service.orchestration.SecondaryDocumentGenerator;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.session.ArtifactWriter;
import com.phillippitts.cvtailor.service.session.SessionService;
import com.phillippitts.cvtailor.service.session.SessionStateMachine;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the outbound adapters and the generation orchestrator explicitly.
 */
@Configuration
public class OrchestrationConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * HTTP backend wrapped in capped exponential backoff for transient failures.
     */
    @Bean
    public GenerationBackend generationBackend(HttpClient httpClient, BackendProperties properties) {
        return new RetryingGenerationBackend(new HttpGenerationBackend(httpClient, properties), properties.getRetry());
    }

    @Bean
    public LinkResolver linkResolver(HttpClient httpClient, LinkProperties properties) {
        return new HttpLinkResolver(httpClient, properties);
    }

    /**
     * Publishes to Micrometer when a {@link GenerationMetrics} bean exists, otherwise a no-op.
     */
    @Bean
    public GenerationMetricsPublisher generationMetricsPublisher(ObjectProvider<GenerationMetrics> metrics) {
        GenerationMetrics available = metrics.getIfAvailable();
        return available == null ? GenerationMetricsPublisher.NOOP : new GenerationMetricsPublisher(available);
    }

    @Bean
    public GenerationOrchestrator generationOrchestrator(SourceDocumentLoader sourceLoader,
                                                         JobContextResolver contextResolver,
                                                         SessionService sessionService,
                                                         SessionStateMachine stateMachine,
                                                         SessionRepository repository,
                                                         ProgressChannel progressChannel,
                                                         PageCountRetryLoop retryLoop,
                                                         SecondaryDocumentGenerator secondaryGenerator,
                                                         ArtifactWriter artifactWriter,
                                                         TextExtractor textExtractor,
                                                         GenerationBackend generationBackend,
                                                         ApplicationEventPublisher publisher,
                                                         GenerationMetricsPublisher metricsPublisher,
                                                         Clock clock,
                                                         GenerationProperties properties) {
        return DefaultGenerationOrchestratorBuilder.builder()
                .sourceLoader(sourceLoader)
                .contextResolver(contextResolver)
                .sessionService(sessionService)
                .stateMachine(stateMachine)
                .repository(repository)
                .progressChannel(progressChannel)
                .retryLoop(retryLoop)
                .secondaryGenerator(secondaryGenerator)
                .artifactWriter(artifactWriter)
                .textExtractor(textExtractor)
                .backend(generationBackend)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .clock(clock)
                .scratchRoot(Path.of(properties.getScratchRoot()))
                .build();
    }
}
