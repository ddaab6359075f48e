package com.phillippitts.cvtailor.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Entry in a session's append-only chat history.
 *
 * <p>Assistant messages closing a generation run carry the run's {@link GenerationResult}
 * and the full log, so a finished run can be replayed without the live stream.
 */
public record ChatMessage(
        ChatRole role,
        String content,
        Instant timestamp,
        GenerationResult result,
        List<LogLine> logs
) {
    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        content = content == null ? "" : content;
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static ChatMessage user(String content, Instant timestamp) {
        return new ChatMessage(ChatRole.USER, content, timestamp, null, List.of());
    }

    public static ChatMessage assistant(String content, Instant timestamp) {
        return new ChatMessage(ChatRole.ASSISTANT, content, timestamp, null, List.of());
    }

    public static ChatMessage assistant(String content, Instant timestamp,
                                        GenerationResult result, List<LogLine> logs) {
        return new ChatMessage(ChatRole.ASSISTANT, content, timestamp, result, logs);
    }
}
