package com.phillippitts.cvtailor.service.session;

import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.domain.SessionState;
import com.phillippitts.cvtailor.domain.SessionStatus;
import com.phillippitts.cvtailor.domain.SessionSummary;
import com.phillippitts.cvtailor.exception.SessionNotFoundException;
import com.phillippitts.cvtailor.service.progress.ProgressChannel;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read side of sessions: history, detail, status and the pull-path log.
 */
@Service
public class SessionService {

    private final SessionRepository repository;
    private final ProgressChannel progressChannel;

    public SessionService(SessionRepository repository, ProgressChannel progressChannel) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.progressChannel = Objects.requireNonNull(progressChannel, "progressChannel must not be null");
    }

    public Session getSession(String ownerId, String sessionId) {
        return repository.find(ownerId, sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<SessionSummary> listSessions(String ownerId) {
        return repository.findAll(ownerId).stream()
                .map(SessionSummary::of)
                .collect(Collectors.toList());
    }

    public SessionStatus getSessionStatus(String ownerId, String sessionId) {
        return SessionStatus.of(getSession(ownerId, sessionId));
    }

    /**
     * Log lines of the session's latest run from {@code fromIndex} on. Served from the live run
     * while one is active, otherwise from the persisted log; both are prefix-consistent.
     *
     * <p>A session that is {@code PROCESSING} before its run has bound a live log reports no
     * lines. The persisted log at that point belongs to the previous run.
     */
    public List<LogLine> getSessionLog(String ownerId, String sessionId, int fromIndex) {
        Session session = getSession(ownerId, sessionId);
        int from = Math.max(0, fromIndex);
        return progressChannel.active(sessionId)
                .map(log -> log.lines(from))
                .orElseGet(() -> {
                    if (session.state() == SessionState.PROCESSING) {
                        return List.of();
                    }
                    List<LogLine> persisted = repository.findLog(ownerId, sessionId);
                    return from >= persisted.size() ? List.of() : List.copyOf(persisted.subList(from, persisted.size()));
                });
    }
}
