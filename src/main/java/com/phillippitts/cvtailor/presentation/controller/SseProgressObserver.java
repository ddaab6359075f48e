package com.phillippitts.cvtailor.presentation.controller;

import com.phillippitts.cvtailor.service.progress.ProgressEvent;
import com.phillippitts.cvtailor.service.progress.ProgressObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Forwards progress events to an SSE stream: {@code id} is the sequence number and
 * {@code event} the kind. A failed send detaches this observer; the run continues.
 */
class SseProgressObserver implements ProgressObserver {

    private static final Logger LOG = LogManager.getLogger(SseProgressObserver.class);

    private final SseEmitter emitter;

    SseProgressObserver(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.sequence()))
                    .name(event.kind().wireName())
                    .data(event.payload(), MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            LOG.debug("SSE client went away at sequence {}", event.sequence());
            throw new UncheckedIOException(e);
        } catch (IllegalStateException e) {
            LOG.debug("SSE stream already closed at sequence {}", event.sequence());
            throw e;
        }
    }

    @Override
    public void onClose() {
        emitter.complete();
    }
}
