package com.phillippitts.cvtailor.service.session;

import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.domain.SessionState;
import com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException;
import com.phillippitts.cvtailor.exception.SessionLockedException;
import com.phillippitts.cvtailor.exception.SessionNotFoundException;
import com.phillippitts.cvtailor.service.storage.SessionRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Thread-safe state machine for session lifecycle and the approval lock.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * (new)                 → PROCESSING          (via create)
 * COMPLETED | FAILED    → PROCESSING          (via beginProcessing, compare-and-swap)
 * PROCESSING            → COMPLETED | FAILED  (via finish)
 * COMPLETED | FAILED    → locked              (via approve, irreversible)
 * </pre>
 *
 * <p>Every read-modify-write of a session happens here, under a per-session {@link ReentrantLock}
 * (striped by session key). {@link #requireMutable(Session)} is the single check for the
 * approval lock and for run ownership; all mutating paths call it before any side effect.
 *
 * <p>A session in {@code PROCESSING} is owned by exactly one generation run. Only that run may
 * change it, through {@link #updateRunOwned} and {@link #finish}.
 */
@Component
public final class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);
    private static final int STRIPES = 64;

    private final SessionRepository repository;
    private final Clock clock;
    private final Lock[] stripes = new Lock[STRIPES];

    public SessionStateMachine(SessionRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Rejects changes to approved sessions and to sessions owned by a running generation.
     *
     * @throws SessionLockedException                  if the session has been approved
     * @throws ConcurrentSessionModificationException if a generation run owns the session
     */
    public static void requireMutable(Session session) {
        if (session.locked()) {
            throw new SessionLockedException(session.id());
        }
        if (session.state() == SessionState.PROCESSING) {
            throw new ConcurrentSessionModificationException(session.id());
        }
    }

    /**
     * Creates and persists a new session already in {@code PROCESSING}, owned by the caller's run.
     */
    public Session create(String ownerId, JobContext jobContext) {
        String id = UUID.randomUUID().toString();
        return withSessionLock(ownerId, id, () -> {
            Session session = Session.startProcessing(id, ownerId, jobContext, clock.instant());
            repository.save(session);
            LOG.info("Session {} created for {} at {}", id, jobContext.jobTitle(), jobContext.companyName());
            return session;
        });
    }

    /**
     * Compare-and-swap of an existing terminal, unlocked session into {@code PROCESSING}.
     * Of two concurrent callers exactly one succeeds.
     *
     * @throws SessionNotFoundException               if the session does not exist
     * @throws SessionLockedException                  if the session has been approved
     * @throws ConcurrentSessionModificationException if another run already owns it
     */
    public Session beginProcessing(String ownerId, String sessionId, JobContext jobContext) {
        return withSessionLock(ownerId, sessionId, () -> {
            Session current = load(ownerId, sessionId);
            requireMutable(current);
            Session claimed = current
                    .withJobContext(jobContext, clock.instant())
                    .withState(SessionState.PROCESSING, clock.instant());
            repository.save(claimed);
            LOG.info("Session {} claimed for regeneration (was {})", sessionId, current.state());
            return claimed;
        });
    }

    /**
     * Applies a change on behalf of the run that owns the session.
     *
     * @throws IllegalStateException if the session is not in {@code PROCESSING}
     */
    public Session updateRunOwned(String ownerId, String sessionId, UnaryOperator<Session> change) {
        return withSessionLock(ownerId, sessionId, () -> {
            Session current = requireProcessing(load(ownerId, sessionId));
            Session updated = change.apply(current);
            repository.save(updated);
            return updated;
        });
    }

    /**
     * Ends a run: applies {@code change} and moves the session to {@code terminalState} in one write.
     *
     * @throws IllegalArgumentException if {@code terminalState} is {@code PROCESSING}
     * @throws IllegalStateException    if the session is not in {@code PROCESSING}
     */
    public Session finish(String ownerId, String sessionId, SessionState terminalState,
                          UnaryOperator<Session> change) {
        if (!terminalState.terminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        return withSessionLock(ownerId, sessionId, () -> {
            Session current = requireProcessing(load(ownerId, sessionId));
            Session updated = change.apply(current).withState(terminalState, clock.instant());
            repository.save(updated);
            LOG.info("Session {} finished as {}", sessionId, terminalState);
            return updated;
        });
    }

    /**
     * Locks a terminal session. Approving an already locked session is a no-op.
     *
     * @throws ConcurrentSessionModificationException if a generation run owns the session
     */
    public Approval approve(String ownerId, String sessionId) {
        return withSessionLock(ownerId, sessionId, () -> {
            Session current = load(ownerId, sessionId);
            if (current.locked()) {
                return new Approval(current, false);
            }
            if (current.state() == SessionState.PROCESSING) {
                throw new ConcurrentSessionModificationException(sessionId);
            }
            Session locked = current.withLock(clock.instant());
            repository.save(locked);
            LOG.info("✓ Session {} approved and locked", sessionId);
            return new Approval(locked, true);
        });
    }

    /**
     * Applies a user-initiated change to an idle session. {@code change} runs only after
     * {@link #requireMutable} passed, so a rejected call has no side effects.
     */
    public Session mutate(String ownerId, String sessionId, UnaryOperator<Session> change) {
        return withSessionLock(ownerId, sessionId, () -> {
            Session current = load(ownerId, sessionId);
            requireMutable(current);
            Session updated = change.apply(current);
            repository.save(updated);
            return updated;
        });
    }

    /**
     * Result of {@link #approve}.
     *
     * @param changed {@code false} when the session was already locked
     */
    public record Approval(Session session, boolean changed) {
    }

    private Session load(String ownerId, String sessionId) {
        return repository.find(ownerId, sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private static Session requireProcessing(Session session) {
        if (session.state() != SessionState.PROCESSING) {
            throw new IllegalStateException("Session " + session.id() + " is not owned by a run (state="
                    + session.state() + ")");
        }
        return session;
    }

    private <T> T withSessionLock(String ownerId, String sessionId, Supplier<T> action) {
        Lock lock = stripes[Math.floorMod((ownerId + "/" + sessionId).hashCode(), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
