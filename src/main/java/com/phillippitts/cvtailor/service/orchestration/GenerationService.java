package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.GenerationResult;
import com.phillippitts.cvtailor.domain.LogLevel;
import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.domain.SessionStatus;
import com.phillippitts.cvtailor.exception.CvTailorException;
import com.phillippitts.cvtailor.exception.ErrorCodes;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.service.orchestration.event.SessionApprovedEvent;
import com.phillippitts.cvtailor.service.progress.BufferedProgressObserver;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.progress.ProgressLog;
import com.phillippitts.cvtailor.service.progress.ProgressObserver;
import com.phillippitts.cvtailor.service.session.SessionService;
import com.phillippitts.cvtailor.service.session.SessionStateMachine;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for generation runs and session approval.
 *
 * <p>{@link #startGeneration} validates what it can synchronously, so obvious rejections
 * (blank input, unknown or locked session) surface to the caller before any work is queued.
 * The run itself executes on the {@code generationExecutor}; its outcome is delivered only
 * through the returned {@link ProgressLog}.
 */
@Service
public class GenerationService {

    private static final Logger LOG = LogManager.getLogger(GenerationService.class);

    static final int SUBSCRIBER_BUFFER = 512;
    static final String APPROVED_LINE = "✓ Session approved and locked";

    private final GenerationOrchestrator orchestrator;
    private final SessionService sessionService;
    private final SessionStateMachine stateMachine;
    private final SessionRepository repository;
    private final ProgressChannel progressChannel;
    private final Executor generationExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final AtomicLong subscriberIds = new AtomicLong();

    public GenerationService(GenerationOrchestrator orchestrator,
                             SessionService sessionService,
                             SessionStateMachine stateMachine,
                             SessionRepository repository,
                             ProgressChannel progressChannel,
                             @Qualifier("generationExecutor") Executor generationExecutor,
                             ApplicationEventPublisher publisher,
                             Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.progressChannel = Objects.requireNonNull(progressChannel, "progressChannel must not be null");
        this.generationExecutor = Objects.requireNonNull(generationExecutor, "generationExecutor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Queues a generation run and returns its progress log.
     *
     * @param observer optional push subscriber; attached before the run starts so it sees every event
     * @throws InputInvalidException if the input is blank
     * @throws com.phillippitts.cvtailor.exception.SessionNotFoundException if the session does not exist
     * @throws com.phillippitts.cvtailor.exception.SessionLockedException if the session is approved
     * @throws com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException if a run owns it
     */
    public ProgressLog startGeneration(GenerationRequest request, ProgressObserver observer) {
        Objects.requireNonNull(request, "request must not be null");
        precheck(request);

        ProgressLog progress = progressChannel.open();
        if (observer != null) {
            progress.attach(new BufferedProgressObserver(observer, SUBSCRIBER_BUFFER,
                    "progress-subscriber-" + subscriberIds.incrementAndGet()));
        }
        generationExecutor.execute(() -> runAndReport(request, progress));
        return progress;
    }

    /**
     * Runs generation on the calling thread.
     */
    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return orchestrator.run(request, progressChannel.open());
    }

    /**
     * Locks a terminal session. Repeated approvals return the same status without side effects.
     */
    public SessionStatus approveSession(String ownerId, String sessionId) {
        SessionStateMachine.Approval approval = stateMachine.approve(ownerId, sessionId);
        if (approval.changed()) {
            appendApprovalLine(ownerId, sessionId);
            publisher.publishEvent(new SessionApprovedEvent(sessionId, ownerId, clock.instant()));
        }
        return SessionStatus.of(approval.session());
    }

    public SessionStatus getSessionStatus(String ownerId, String sessionId) {
        return sessionService.getSessionStatus(ownerId, sessionId);
    }

    public List<LogLine> getSessionLog(String ownerId, String sessionId, int fromIndex) {
        return sessionService.getSessionLog(ownerId, sessionId, fromIndex);
    }

    private void precheck(GenerationRequest request) {
        if (request.input() == null || request.input().isBlank()) {
            throw new InputInvalidException("job description or link is required");
        }
        if (request.sessionId() != null) {
            SessionStateMachine.requireMutable(sessionService.getSession(request.ownerId(), request.sessionId()));
        }
    }

    /**
     * The orchestrator has already recorded the failure on the progress log and the session,
     * so here it is only logged.
     */
    private void runAndReport(GenerationRequest request, ProgressLog progress) {
        try {
            orchestrator.run(request, progress);
        } catch (CvTailorException e) {
            LOG.warn("Generation run ended with {}: {}", ErrorCodes.of(e), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Generation run ended with an unexpected error", e);
        }
    }

    private void appendApprovalLine(String ownerId, String sessionId) {
        List<LogLine> lines = new ArrayList<>(repository.findLog(ownerId, sessionId));
        lines.add(new LogLine(lines.size(), clock.instant(), LogLevel.SUCCESS, APPROVED_LINE));
        repository.saveLog(ownerId, sessionId, lines);
    }
}
