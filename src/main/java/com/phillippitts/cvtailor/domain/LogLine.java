package com.phillippitts.cvtailor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One human-readable progress line. {@code index} is the zero-based position in the session log.
 */
public record LogLine(int index, Instant timestamp, LogLevel level, String message) {

    public LogLine {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(level, "level must not be null");
        message = message == null ? "" : message;
    }
}
