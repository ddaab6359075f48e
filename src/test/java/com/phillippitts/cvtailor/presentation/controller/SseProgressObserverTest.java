package com.phillippitts.cvtailor.presentation.controller;

import com.phillippitts.cvtailor.service.progress.ProgressLog;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SseProgressObserverTest {

    @Test
    void forwardsEventsAndCompletesStream() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        ProgressLog log = new ProgressLog(Clock.systemUTC());
        log.attach(new SseProgressObserver(emitter));

        log.info("one");
        log.fail("INPUT_INVALID", "blank input");

        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter).complete();
    }

    @Test
    void failedSendSurfacesAsUncheckedError() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        doThrow(new IOException("Broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        SseProgressObserver observer = new SseProgressObserver(emitter);
        ProgressLog log = new ProgressLog(Clock.systemUTC());
        log.info("one");

        assertThatThrownBy(() -> observer.onEvent(log.events().get(0)))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void runContinuesAfterClientDisconnects() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        doThrow(new IOException("Broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        ProgressLog log = new ProgressLog(Clock.systemUTC());
        AtomicInteger delivered = new AtomicInteger();
        log.attach(new SseProgressObserver(emitter));
        log.attach(event -> delivered.incrementAndGet());

        log.info("one");
        log.info("two");

        verify(emitter, times(1)).send(any(SseEmitter.SseEventBuilder.class));
        assertThat(delivered.get()).isEqualTo(2);
    }
}
