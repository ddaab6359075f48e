package com.phillippitts.cvtailor.service.backend;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A prompt kind plus the variables substituted into its template.
 */
public record GenerationPrompt(PromptKind kind, Map<String, String> variables) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    public GenerationPrompt {
        Objects.requireNonNull(kind, "kind must not be null");
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public static GenerationPrompt of(PromptKind kind) {
        return new GenerationPrompt(kind, Map.of());
    }

    /**
     * Returns a copy with one more variable. Null values are stored as empty strings.
     */
    public GenerationPrompt with(String name, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(variables);
        copy.put(name, value == null ? "" : String.valueOf(value));
        return new GenerationPrompt(kind, copy);
    }

    public String variable(String name) {
        return variables.getOrDefault(name, "");
    }

    /**
     * Fills the template. Unknown placeholders render as empty text.
     */
    public String render() {
        Matcher matcher = PLACEHOLDER.matcher(kind.template());
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(variable(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
