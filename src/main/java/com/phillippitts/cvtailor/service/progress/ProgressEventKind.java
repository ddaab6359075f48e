package com.phillippitts.cvtailor.service.progress;

/**
 * Event kinds on the progress stream. {@link #wireName()} is the SSE event name.
 */
public enum ProgressEventKind {
    LOG("log"),
    SESSION("session"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    ProgressEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
