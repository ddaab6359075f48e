package com.phillippitts.cvtailor.service.link;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decides whether job input is a link to fetch or pasted description text.
 */
public final class InputClassifier {

    private InputClassifier() {
    }

    /**
     * @return {@code true} for a single http(s) URL with a host and no whitespace
     */
    public static boolean isUrl(String input) {
        if (input == null) {
            return false;
        }
        String trimmed = input.trim();
        String lower = trimmed.toLowerCase();
        if (!(lower.startsWith("http://") || lower.startsWith("https://")) || trimmed.matches(".*\\s.*")) {
            return false;
        }
        try {
            URI uri = new URI(trimmed);
            return uri.getHost() != null && !uri.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
