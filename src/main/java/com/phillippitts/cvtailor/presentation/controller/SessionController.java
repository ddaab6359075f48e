package com.phillippitts.cvtailor.presentation.controller;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.domain.SessionStatus;
import com.phillippitts.cvtailor.domain.SessionSummary;
import com.phillippitts.cvtailor.presentation.dto.ContentRequest;
import com.phillippitts.cvtailor.presentation.dto.RefineRequest;
import com.phillippitts.cvtailor.service.orchestration.GenerationService;
import com.phillippitts.cvtailor.service.session.ArtifactContent;
import com.phillippitts.cvtailor.service.session.RefinedDocument;
import com.phillippitts.cvtailor.service.session.SessionMutationService;
import com.phillippitts.cvtailor.service.session.SessionService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session history, pull-path progress, approval and per-document operations.
 * The owner is taken from {@code X-User-ID}.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final String OWNER_HEADER = "X-User-ID";

    private final SessionService sessionService;
    private final GenerationService generationService;
    private final SessionMutationService mutationService;

    SessionController(SessionService sessionService, GenerationService generationService,
                      SessionMutationService mutationService) {
        this.sessionService = sessionService;
        this.generationService = generationService;
        this.mutationService = mutationService;
    }

    @GetMapping
    List<SessionSummary> list(@RequestHeader(OWNER_HEADER) String ownerId) {
        return sessionService.listSessions(ownerId);
    }

    @GetMapping("/{id}")
    Session get(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return sessionService.getSession(ownerId, id);
    }

    @GetMapping("/{id}/log")
    List<LogLine> log(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id,
                      @RequestParam(name = "from", defaultValue = "0") int from) {
        return generationService.getSessionLog(ownerId, id, from);
    }

    @GetMapping("/{id}/status")
    SessionStatus status(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return generationService.getSessionStatus(ownerId, id);
    }

    @PostMapping("/{id}/approve")
    SessionStatus approve(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id) {
        return generationService.approveSession(ownerId, id);
    }

    @PostMapping("/{id}/refine")
    RefinedDocument refine(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id,
                           @RequestBody RefineRequest body) {
        return mutationService.refineDocument(ownerId, id, DocumentType.fromWireName(body.documentType()),
                body.feedback());
    }

    @PutMapping("/{id}/documents/{type}")
    SessionStatus saveContent(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id,
                              @PathVariable("type") String type, @RequestBody ContentRequest body) {
        return SessionStatus.of(mutationService.saveContent(ownerId, id, DocumentType.fromWireName(type),
                body.content()));
    }

    @DeleteMapping("/{id}/documents/{type}")
    SessionStatus delete(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id,
                         @PathVariable("type") String type) {
        return SessionStatus.of(mutationService.deleteArtifact(ownerId, id, DocumentType.fromWireName(type)));
    }

    @GetMapping("/{id}/documents/{type}")
    ResponseEntity<byte[]> download(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String id,
                                    @PathVariable("type") String type,
                                    @RequestParam(name = "format", required = false) String format) {
        ArtifactContent artifact = mutationService.readArtifact(ownerId, id, DocumentType.fromWireName(type), format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.mediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.fileName()).build().toString())
                .body(artifact.bytes());
    }
}
