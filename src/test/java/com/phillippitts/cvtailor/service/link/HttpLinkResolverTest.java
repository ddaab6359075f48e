package com.phillippitts.cvtailor.service.link;

import com.phillippitts.cvtailor.config.properties.LinkProperties;
import com.phillippitts.cvtailor.exception.UpstreamFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HttpLinkResolverTest {

    private static final String URL = "https://jobs.acme.test/42";

    private HttpClient client;
    private HttpResponse<String> response;

    @BeforeEach
    void setUp() throws Exception {
        client = mock(HttpClient.class);
        response = mock();
        doReturn(response).when(client).send(any(HttpRequest.class), any());
    }

    private HttpLinkResolver resolver(int maxChars) {
        return new HttpLinkResolver(client, new LinkProperties(Duration.ofSeconds(3), maxChars));
    }

    @Test
    void shouldReduceHtmlToReadableText() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("<html><head><style>p{}</style><script>track()</script></head>"
                + "<body><h1>Engineer</h1><p>Build&nbsp;things &amp; ship</p></body></html>");

        String text = resolver(1000).fetchText(URL);

        assertThat(text).contains("Engineer").contains("Build things & ship");
        assertThat(text).doesNotContain("track()").doesNotContain("<").doesNotContain("p{}");
    }

    @Test
    void shouldCapFetchedText() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("x".repeat(5000));

        assertThat(resolver(1000).fetchText(URL)).hasSize(1000);
    }

    @Test
    void shouldFailOnErrorStatus() {
        when(response.statusCode()).thenReturn(404);

        assertThatThrownBy(() -> resolver(1000).fetchText(URL))
                .isInstanceOf(UpstreamFetchException.class)
                .hasMessageContaining("HTTP 404")
                .satisfies(e -> assertThat(((UpstreamFetchException) e).getUrl()).isEqualTo(URL));
    }

    @Test
    void shouldFailOnPageWithoutText() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("<html><script>app()</script></html>");

        assertThatThrownBy(() -> resolver(1000).fetchText(URL))
                .isInstanceOf(UpstreamFetchException.class)
                .hasMessageContaining("no readable text");
    }

    @Test
    void shouldWrapConnectionFailure() throws Exception {
        doThrow(new ConnectException("refused")).when(client).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> resolver(1000).fetchText(URL))
                .isInstanceOf(UpstreamFetchException.class)
                .hasMessageContaining("ConnectException")
                .hasCauseInstanceOf(ConnectException.class);
    }

    @Test
    void shouldRejectMalformedUrl() {
        assertThatThrownBy(() -> resolver(1000).fetchText("https://bad host/"))
                .isInstanceOf(UpstreamFetchException.class)
                .hasMessageContaining("malformed URL");
    }
}
