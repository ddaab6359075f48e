package com.phillippitts.cvtailor.service.progress;

import com.phillippitts.cvtailor.domain.GenerationResult;
import com.phillippitts.cvtailor.domain.LogLevel;
import com.phillippitts.cvtailor.domain.LogLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered event record of one generation run.
 *
 * <p>Every emission appends to the event list and is delivered to attached observers before
 * {@code emit} returns, under the log's monitor, so all observers see the same total order.
 * Observers that throw are detached. Log lines are also kept separately as the pull-side
 * session log; a snapshot is always a prefix of any later snapshot.
 *
 * <p>After a terminal event ({@code COMPLETE} or terminal {@code ERROR}) the log is closed
 * and further emissions are rejected.
 */
public final class ProgressLog implements ProgressReporter {

    private static final Logger LOG = LogManager.getLogger(ProgressLog.class);

    private final Clock clock;
    private final List<ProgressEvent> events = new ArrayList<>();
    private final List<LogLine> lines = new ArrayList<>();
    private final List<ProgressObserver> observers = new ArrayList<>();
    private String sessionId;
    private boolean closed;

    public ProgressLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Attaches an observer and replays every event emitted so far, so a late subscriber still
     * receives the complete stream in order.
     */
    public synchronized void attach(ProgressObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        for (ProgressEvent event : events) {
            if (!deliver(observer, event)) {
                return;
            }
        }
        if (closed) {
            closeQuietly(observer);
        } else {
            observers.add(observer);
        }
    }

    public synchronized void detach(ProgressObserver observer) {
        observers.remove(observer);
    }

    @Override
    public void info(String message) {
        log(LogLevel.INFO, message);
    }

    @Override
    public void success(String message) {
        log(LogLevel.SUCCESS, message);
    }

    @Override
    public void warn(String message) {
        log(LogLevel.WARN, message);
    }

    @Override
    public void error(String message) {
        log(LogLevel.ERROR, message);
    }

    public synchronized LogLine log(LogLevel level, String message) {
        LogLine line = new LogLine(lines.size(), clock.instant(), level, message);
        lines.add(line);
        emit(ProgressEventKind.LOG, line);
        return line;
    }

    /**
     * Announces the session the run is bound to. Emitted once, before any document is generated.
     */
    public synchronized void announceSession(String id) {
        if (sessionId != null) {
            throw new IllegalStateException("Session already announced: " + sessionId);
        }
        sessionId = Objects.requireNonNull(id, "id must not be null");
        emit(ProgressEventKind.SESSION, new SessionAnnouncement(id));
    }

    /**
     * Emits a non-terminal error; the run continues.
     */
    public synchronized void advisory(String errorCode, String message) {
        emit(ProgressEventKind.ERROR, new ProgressError(errorCode, message, false));
    }

    public synchronized void complete(GenerationResult result) {
        emit(ProgressEventKind.COMPLETE, result);
        close();
    }

    public synchronized void fail(String errorCode, String message) {
        emit(ProgressEventKind.ERROR, new ProgressError(errorCode, message, true));
        close();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized Optional<String> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    public synchronized List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<LogLine> lines() {
        return List.copyOf(lines);
    }

    /**
     * Log lines from {@code fromIndex} (inclusive). An index past the end yields an empty list.
     */
    public synchronized List<LogLine> lines(int fromIndex) {
        if (fromIndex >= lines.size()) {
            return List.of();
        }
        return List.copyOf(lines.subList(Math.max(0, fromIndex), lines.size()));
    }

    private void emit(ProgressEventKind kind, Object payload) {
        if (closed) {
            throw new IllegalStateException("Progress log is closed; cannot emit " + kind);
        }
        ProgressEvent event = new ProgressEvent(events.size(), kind, clock.instant(), payload);
        events.add(event);
        for (ProgressObserver observer : new ArrayList<>(observers)) {
            if (!deliver(observer, event)) {
                observers.remove(observer);
            }
        }
    }

    private void close() {
        closed = true;
        for (ProgressObserver observer : observers) {
            closeQuietly(observer);
        }
        observers.clear();
    }

    private static boolean deliver(ProgressObserver observer, ProgressEvent event) {
        try {
            observer.onEvent(event);
            return true;
        } catch (RuntimeException e) {
            LOG.debug("Detaching progress observer after delivery failure: {}", e.toString());
            return false;
        }
    }

    private static void closeQuietly(ProgressObserver observer) {
        try {
            observer.onClose();
        } catch (RuntimeException e) {
            LOG.debug("Progress observer failed on close: {}", e.toString());
        }
    }
}
