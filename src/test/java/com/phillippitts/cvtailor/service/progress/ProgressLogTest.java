package com.phillippitts.cvtailor.service.progress;

import com.phillippitts.cvtailor.domain.GenerationResult;
import com.phillippitts.cvtailor.domain.LogLevel;
import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.testutil.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressLogTest {

    private ProgressLog log;

    @BeforeEach
    void setUp() {
        log = new ProgressLog(Clock.fixed(Instant.parse("2025-03-14T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldNumberEventsContiguouslyFromZero() {
        RecordingObserver observer = new RecordingObserver();
        log.attach(observer);

        log.info("one");
        log.announceSession("s-1");
        log.warn("two");
        log.advisory("GENERATION_BACKEND_UNAVAILABLE", "cover letter failed");

        assertThat(observer.sequences()).containsExactly(0L, 1L, 2L, 3L);
        assertThat(observer.kinds()).containsExactly(ProgressEventKind.LOG, ProgressEventKind.SESSION,
                ProgressEventKind.LOG, ProgressEventKind.ERROR);
    }

    @Test
    void shouldReplayHistoryToLateObserver() {
        RecordingObserver early = new RecordingObserver();
        log.attach(early);
        log.info("one");
        log.success("two");

        RecordingObserver late = new RecordingObserver();
        log.attach(late);
        log.error("three");

        assertThat(late.events()).isEqualTo(early.events());
    }

    @Test
    void shouldCloseOnCompleteAndRejectFurtherEmissions() {
        RecordingObserver observer = new RecordingObserver();
        log.attach(observer);

        log.complete(GenerationResult.failed("s-1", null, "x"));

        assertThat(log.isClosed()).isTrue();
        assertThat(observer.closeCount()).isEqualTo(1);
        assertThat(log.events().get(0).terminal()).isTrue();
        assertThatThrownBy(() -> log.info("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldTreatOnlyTerminalErrorAsEndOfRun() {
        log.advisory("GENERATION_BACKEND_UNAVAILABLE", "cold email failed");
        assertThat(log.isClosed()).isFalse();

        log.fail("INPUT_INVALID", "blank input");

        assertThat(log.isClosed()).isTrue();
        List<ProgressEvent> events = log.events();
        assertThat(events.get(0).terminal()).isFalse();
        assertThat(events.get(1).terminal()).isTrue();
        assertThat(((ProgressError) events.get(1).payload()).errorCode()).isEqualTo("INPUT_INVALID");
    }

    @Test
    void shouldReplayAndCloseObserverAttachedAfterEnd() {
        log.info("one");
        log.fail("INTERNAL_ERROR", "boom");

        RecordingObserver observer = new RecordingObserver();
        log.attach(observer);

        assertThat(observer.events()).hasSize(2);
        assertThat(observer.isClosed()).isTrue();
    }

    @Test
    void shouldDetachObserverThatThrows() {
        RecordingObserver healthy = new RecordingObserver();
        int[] calls = {0};
        log.attach(event -> {
            calls[0]++;
            throw new IllegalStateException("client gone");
        });
        log.attach(healthy);

        log.info("one");
        log.info("two");

        assertThat(calls[0]).isEqualTo(1);
        assertThat(healthy.events()).hasSize(2);
    }

    @Test
    void shouldAnnounceSessionOnlyOnce() {
        log.announceSession("s-1");

        assertThat(log.sessionId()).hasValue("s-1");
        assertThatThrownBy(() -> log.announceSession("s-2")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldKeepLogLinesAsIndexedPrefixSnapshots() {
        log.info("one");
        List<LogLine> before = log.lines();
        log.announceSession("s-1");
        log.warn("two");

        List<LogLine> after = log.lines();
        assertThat(after).startsWith(before.toArray(new LogLine[0]));
        assertThat(after).extracting(LogLine::index).containsExactly(0, 1);
        assertThat(after.get(1).level()).isEqualTo(LogLevel.WARN);
    }

    @Test
    void shouldReturnLinesFromIndex() {
        log.info("one");
        log.info("two");
        log.info("three");

        assertThat(log.lines(1)).extracting(LogLine::message).containsExactly("two", "three");
        assertThat(log.lines(3)).isEmpty();
        assertThat(log.lines(10)).isEmpty();
        assertThat(log.lines(-5)).hasSize(3);
    }
}
