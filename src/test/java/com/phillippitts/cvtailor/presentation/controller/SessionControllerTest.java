package com.phillippitts.cvtailor.presentation.controller;

import com.phillippitts.cvtailor.domain.DocumentType;
import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.domain.SessionState;
import com.phillippitts.cvtailor.domain.SessionStatus;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.presentation.dto.ContentRequest;
import com.phillippitts.cvtailor.presentation.dto.RefineRequest;
import com.phillippitts.cvtailor.service.orchestration.GenerationService;
import com.phillippitts.cvtailor.service.session.ArtifactContent;
import com.phillippitts.cvtailor.service.session.RefinedDocument;
import com.phillippitts.cvtailor.service.session.SessionMutationService;
import com.phillippitts.cvtailor.service.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");

    private SessionService sessionService;
    private GenerationService generationService;
    private SessionMutationService mutationService;
    private SessionController controller;

    @BeforeEach
    void setUp() {
        sessionService = mock(SessionService.class);
        generationService = mock(GenerationService.class);
        mutationService = mock(SessionMutationService.class);
        controller = new SessionController(sessionService, generationService, mutationService);
    }

    @Test
    void resolvesDocumentTypeForRefinement() {
        RefinedDocument refined = new RefinedDocument(DocumentType.COVER_LETTER, "Dear Acme", null, true);
        when(mutationService.refineDocument("alice", "s-1", DocumentType.COVER_LETTER, "warmer"))
                .thenReturn(refined);

        assertThat(controller.refine("alice", "s-1", new RefineRequest("cover-letter", "warmer")))
                .isEqualTo(refined);
    }

    @Test
    void rejectsUnknownDocumentTypeBeforeCallingService() {
        assertThatThrownBy(() -> controller.refine("alice", "s-1", new RefineRequest("resume", "x")))
                .isInstanceOf(InputInvalidException.class);
        verifyNoInteractions(mutationService);
    }

    @Test
    void returnsStatusAfterSavingContent() {
        Session session = Session.startProcessing("s-1", "alice", JobContext.of("d", "Acme", "Engineer"), NOW)
                .withState(SessionState.COMPLETED, NOW);
        when(mutationService.saveContent("alice", "s-1", DocumentType.COLD_EMAIL, "Hi"))
                .thenReturn(session);

        SessionStatus status = controller.saveContent("alice", "s-1", "cold-email", new ContentRequest("Hi"));

        assertThat(status.sessionId()).isEqualTo("s-1");
        assertThat(status.state()).isEqualTo(SessionState.COMPLETED);
    }

    @Test
    void servesDownloadAsAttachment() {
        byte[] pdf = "%PDF".getBytes(StandardCharsets.UTF_8);
        when(mutationService.readArtifact("alice", "s-1", DocumentType.CV, "pdf"))
                .thenReturn(new ArtifactContent("2025-03-14_Acme_Engineer_alice_CV.pdf", "application/pdf", pdf));

        ResponseEntity<byte[]> response = controller.download("alice", "s-1", "cv", "pdf");

        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PDF);
        assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
                .startsWith("attachment")
                .contains("2025-03-14_Acme_Engineer_alice_CV.pdf");
        assertThat(response.getBody()).isEqualTo(pdf);
    }
}
