package com.phillippitts.cvtailor.service.backend;

import com.phillippitts.cvtailor.config.properties.BackendProperties;
import com.phillippitts.cvtailor.exception.PermanentBackendException;
import com.phillippitts.cvtailor.exception.TransientBackendException;
import com.phillippitts.cvtailor.util.LogSanitizer;
import com.phillippitts.cvtailor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link GenerationBackend} that posts prompts as JSON to an HTTP text-generation endpoint.
 *
 * <p>Request body: {@code {"model": .., "prompt": .., "stream": false}}. The response text is read
 * from the first present field of {@code response}, {@code text}, {@code output},
 * {@code choices[0].message.content} or {@code content[0].text}.
 *
 * <p>Status 429 and 5xx, timeouts and connection failures are transient; other 4xx and
 * unreadable bodies are permanent.
 */
public final class HttpGenerationBackend implements GenerationBackend {

    private static final Logger LOG = LogManager.getLogger(HttpGenerationBackend.class);

    private final HttpClient client;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;

    public HttpGenerationBackend(HttpClient client, BackendProperties properties) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        this.endpoint = URI.create(properties.getEndpoint());
        this.model = properties.getModel();
        this.apiKey = properties.getApiKey();
        this.requestTimeout = properties.getRequestTimeout();
    }

    @Override
    public String generate(GenerationPrompt prompt) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        JSONObject payload = new JSONObject()
                .put("model", model)
                .put("prompt", prompt.render())
                .put("stream", false);

        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8));
        if (!apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientBackendException("Generation backend timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new TransientBackendException("Generation backend unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentBackendException("Interrupted while waiting for generation backend", e);
        }

        int status = response.statusCode();
        LOG.debug("Generation backend kind={} status={} durationMs={}", prompt.kind(), status,
                TimeUtils.elapsedMillis(start));
        if (status == 429 || status >= 500) {
            throw new TransientBackendException("Generation backend returned " + status, status);
        }
        if (status >= 400) {
            throw new PermanentBackendException("Generation backend rejected request (" + status + "): "
                    + LogSanitizer.truncate(response.body(), 200));
        }
        return extractText(response.body());
    }

    /**
     * Reads the generated text from a response body.
     *
     * @throws PermanentBackendException if the body is not JSON or carries no text
     */
    static String extractText(String body) {
        String text;
        try {
            JSONObject json = new JSONObject(body);
            text = firstText(json);
        } catch (JSONException e) {
            throw new PermanentBackendException("Generation backend returned malformed JSON", e);
        }
        if (text == null || text.isBlank()) {
            throw new PermanentBackendException("Generation backend returned no text");
        }
        return text;
    }

    private static String firstText(JSONObject json) {
        for (String key : new String[] {"response", "text", "output"}) {
            String value = json.optString(key, null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        JSONArray choices = json.optJSONArray("choices");
        if (choices != null && !choices.isEmpty()) {
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            if (message != null) {
                return message.optString("content", null);
            }
        }
        JSONArray content = json.optJSONArray("content");
        if (content != null && !content.isEmpty()) {
            return content.getJSONObject(0).optString("text", null);
        }
        return null;
    }
}
