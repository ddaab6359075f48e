package com.phillippitts.cvtailor.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link CompileException} carrying process context.
 *
 * <pre>
 * throw CompileExceptionBuilder.create("Non-zero exit")
 *         .tool("pdfinfo")
 *         .exitCode(1)
 *         .durationMs(120)
 *         .diagnostics(stderrSnippet)
 *         .metadata("file", pdfPath)
 *         .build();
 * </pre>
 *
 * <p>Final message format: {@code {message} (exitCode=.., durationMs=.., key=value) (tool: name)}.
 */
public final class CompileExceptionBuilder {

    private final String message;
    private String toolName;
    private String diagnostics;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CompileExceptionBuilder(String message) {
        this.message = message;
    }

    public static CompileExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CompileExceptionBuilder(message);
    }

    public CompileExceptionBuilder tool(String toolName) {
        this.toolName = toolName;
        return this;
    }

    public CompileExceptionBuilder diagnostics(String diagnostics) {
        this.diagnostics = diagnostics;
        return this;
    }

    public CompileExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public CompileExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public CompileExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     */
    public CompileExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public CompileException build() {
        String tool = toolName != null ? toolName : "unknown";
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new CompileException(detailed, tool, diagnostics, cause);
        }
        return new CompileException(detailed, tool, diagnostics);
    }

    private String buildDetailedMessage() {
        StringJoiner details = new StringJoiner(", ", " (", ")");
        details.setEmptyValue("");
        if (exitCode != null) {
            details.add("exitCode=" + exitCode);
        }
        if (durationMs != null) {
            details.add("durationMs=" + durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            details.add(entry.getKey() + "=" + entry.getValue());
        }
        return message + details;
    }
}
