package com.phillippitts.cvtailor.service.link;

import com.phillippitts.cvtailor.config.properties.LinkProperties;
import com.phillippitts.cvtailor.exception.UpstreamFetchException;
import com.phillippitts.cvtailor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link LinkResolver} over {@link HttpClient}. Strips scripts, styles and markup, collapses
 * whitespace and caps the result at {@code generation.link.max-chars}.
 */
public final class HttpLinkResolver implements LinkResolver {

    private static final Logger LOG = LogManager.getLogger(HttpLinkResolver.class);

    private static final Pattern SCRIPT_OR_STYLE =
            Pattern.compile("(?is)<(script|style|noscript)[^>]*>.*?</\\1>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    private final HttpClient client;
    private final LinkProperties properties;

    public HttpLinkResolver(HttpClient client, LinkProperties properties) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String fetchText(String url) {
        long start = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url.trim()))
                    .timeout(properties.getTimeout())
                    .header("User-Agent", "Mozilla/5.0 (compatible; cv-tailor)")
                    .header("Accept", "text/html,text/plain;q=0.9,*/*;q=0.5")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new UpstreamFetchException(url, "malformed URL", e);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UpstreamFetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException(url, "interrupted", e);
        }

        if (response.statusCode() >= 400) {
            throw new UpstreamFetchException(url, "HTTP " + response.statusCode());
        }
        String text = toPlainText(response.body());
        if (text.isBlank()) {
            throw new UpstreamFetchException(url, "page contains no readable text");
        }
        LOG.info("Fetched job posting: {} chars in {}ms", text.length(), TimeUtils.elapsedMillis(start));
        return text.length() <= properties.getMaxChars() ? text : text.substring(0, properties.getMaxChars());
    }

    static String toPlainText(String html) {
        if (html == null) {
            return "";
        }
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        text = text.replaceAll("(?i)<br\\s*/?>|</p>|</div>|</li>|</h[1-6]>", "\n");
        text = TAG.matcher(text).replaceAll(" ");
        text = text.replace("&nbsp;", " ").replace("&amp;", "&").replace("&lt;", "<")
                .replace("&gt;", ">").replace("&quot;", "\"").replace("&#39;", "'");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }
}
