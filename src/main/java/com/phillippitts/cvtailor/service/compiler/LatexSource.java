package com.phillippitts.cvtailor.service.compiler;

import java.util.regex.Pattern;

/**
 * Normalizes generated LaTeX before it is written to disk.
 */
public final class LatexSource {

    private static final Pattern OPENING_FENCE = Pattern.compile("^\\s*```(?:latex|tex)?[ \\t]*\\R?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\R?[ \\t]*```\\s*$");

    private LatexSource() {
    }

    /**
     * Strips a surrounding markdown code fence ({@code ```latex}, {@code ```tex} or {@code ```}).
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String withoutOpening = OPENING_FENCE.matcher(raw).replaceFirst("");
        return CLOSING_FENCE.matcher(withoutOpening).replaceFirst("").trim();
    }
}
