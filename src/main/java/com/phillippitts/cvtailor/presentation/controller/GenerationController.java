package com.phillippitts.cvtailor.presentation.controller;

import com.phillippitts.cvtailor.domain.GenerationPreferences;
import com.phillippitts.cvtailor.presentation.dto.GenerateRequest;
import com.phillippitts.cvtailor.service.orchestration.GenerationRequest;
import com.phillippitts.cvtailor.service.orchestration.GenerationService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;

/**
 * Starts a generation run and streams its progress as server-sent events.
 *
 * <p>Rejections that can be decided up front (blank input, unknown or locked session) come
 * back as a regular JSON error. Everything after that arrives on the stream, ending with a
 * {@code complete} or terminal {@code error} event. Clients that lose the stream recover
 * through {@code GET /api/sessions/{id}/log} and {@code /status}.
 */
@RestController
class GenerationController {

    private static final Logger LOG = LogManager.getLogger(GenerationController.class);

    static final Duration STREAM_TIMEOUT = Duration.ofMinutes(30);

    private final GenerationService generationService;

    GenerationController(GenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping(path = "/api/generate", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter generate(@RequestHeader("X-User-ID") String ownerId, @RequestBody GenerateRequest body) {
        GenerationRequest request = new GenerationRequest(ownerId, body.input(), body.sessionId(),
                GenerationPreferences.of(body.coverLetter(), body.coldEmail()));
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT.toMillis());
        generationService.startGeneration(request, new SseProgressObserver(emitter));
        LOG.info("Generation queued (session={})", request.sessionId() == null ? "new" : request.sessionId());
        return emitter;
    }
}
