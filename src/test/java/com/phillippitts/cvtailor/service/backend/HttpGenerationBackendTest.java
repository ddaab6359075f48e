package com.phillippitts.cvtailor.service.backend;

import com.phillippitts.cvtailor.config.properties.BackendProperties;
import com.phillippitts.cvtailor.exception.PermanentBackendException;
import com.phillippitts.cvtailor.exception.TransientBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpGenerationBackendTest {

    private HttpClient client;
    private HttpResponse<String> response;
    private HttpGenerationBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        client = mock(HttpClient.class);
        response = mock();
        doReturn(response).when(client).send(any(HttpRequest.class), any());
        BackendProperties properties = new BackendProperties("http://backend.test/api/generate", "test-model",
                "secret", Duration.ofSeconds(5), null);
        backend = new HttpGenerationBackend(client, properties);
    }

    private void respond(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
    }

    @Test
    void shouldReturnTextFromSuccessfulResponse() throws Exception {
        respond(200, "{\"response\":\"Dear Acme\"}");

        String text = backend.generate(GenerationPrompt.of(PromptKind.COVER_LETTER));

        assertThat(text).isEqualTo("Dear Acme");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("http://backend.test/api/generate");
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer secret");
        assertThat(request.getValue().timeout()).hasValue(Duration.ofSeconds(5));
    }

    @Test
    void shouldTreatRateLimitAsTransient() {
        respond(429, "slow down");

        assertThatThrownBy(() -> backend.generate(GenerationPrompt.of(PromptKind.COLD_EMAIL)))
                .isInstanceOf(TransientBackendException.class)
                .satisfies(e -> assertThat(((TransientBackendException) e).getStatusCode()).isEqualTo(429));
    }

    @Test
    void shouldTreatServerErrorsAsTransient() {
        respond(503, "overloaded");

        assertThatThrownBy(() -> backend.generate(GenerationPrompt.of(PromptKind.COLD_EMAIL)))
                .isInstanceOf(TransientBackendException.class);
    }

    @Test
    void shouldTreatClientErrorsAsPermanent() {
        respond(401, "{\"error\":\"invalid api key\"}");

        assertThatThrownBy(() -> backend.generate(GenerationPrompt.of(PromptKind.COLD_EMAIL)))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("401")
                .hasMessageContaining("invalid api key");
    }

    @Test
    void shouldTreatTimeoutsAsTransient() throws Exception {
        doThrow(new HttpTimeoutException("timed out")).when(client).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> backend.generate(GenerationPrompt.of(PromptKind.GENERATE_CV)))
                .isInstanceOf(TransientBackendException.class)
                .hasMessageContaining("timed out after 5s");
    }

    @Test
    void shouldTreatConnectionFailuresAsTransient() throws Exception {
        doThrow(new ConnectException("Connection refused")).when(client).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> backend.generate(GenerationPrompt.of(PromptKind.GENERATE_CV)))
                .isInstanceOf(TransientBackendException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldReadChatCompletionShape() {
        String body = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Hi Acme\"}}]}";

        assertThat(HttpGenerationBackend.extractText(body)).isEqualTo("Hi Acme");
    }

    @Test
    void shouldReadContentBlockShape() {
        String body = "{\"content\":[{\"type\":\"text\",\"text\":\"Hello\"}]}";

        assertThat(HttpGenerationBackend.extractText(body)).isEqualTo("Hello");
    }

    @Test
    void shouldRejectMalformedBody() {
        assertThatThrownBy(() -> HttpGenerationBackend.extractText("<html>502</html>"))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("malformed JSON");
    }

    @Test
    void shouldRejectBodyWithoutText() {
        assertThatThrownBy(() -> HttpGenerationBackend.extractText("{\"response\":\"  \"}"))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("no text");
    }
}
