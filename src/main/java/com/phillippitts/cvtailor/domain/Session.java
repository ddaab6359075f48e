package com.phillippitts.cvtailor.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one generation session.
 *
 * <p>All changes produce a new snapshot; persistence and transition rules live in
 * {@code SessionStateMachine}. {@code locked} only ever goes from false to true.
 */
public record Session(
        String id,
        String ownerId,
        SessionState state,
        boolean locked,
        JobContext jobContext,
        ArtifactRefs artifacts,
        List<ChatMessage> chatHistory,
        Instant createdAt,
        Instant updatedAt
) {
    public Session {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        artifacts = artifacts == null ? ArtifactRefs.EMPTY : artifacts;
        chatHistory = chatHistory == null ? List.of() : List.copyOf(chatHistory);
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    /**
     * Creates a session that is owned by a generation run from the start.
     */
    public static Session startProcessing(String id, String ownerId, JobContext jobContext, Instant now) {
        return new Session(id, ownerId, SessionState.PROCESSING, false, jobContext,
                ArtifactRefs.EMPTY, List.of(), now, now);
    }

    public Session withState(SessionState newState, Instant now) {
        return new Session(id, ownerId, newState, locked, jobContext, artifacts, chatHistory, createdAt, now);
    }

    public Session withLock(Instant now) {
        return new Session(id, ownerId, state, true, jobContext, artifacts, chatHistory, createdAt, now);
    }

    public Session withJobContext(JobContext context, Instant now) {
        return new Session(id, ownerId, state, locked, context, artifacts, chatHistory, createdAt, now);
    }

    public Session withArtifacts(ArtifactRefs refs, Instant now) {
        return new Session(id, ownerId, state, locked, jobContext, refs, chatHistory, createdAt, now);
    }

    public Session append(ChatMessage message, Instant now) {
        List<ChatMessage> history = new ArrayList<>(chatHistory);
        history.add(Objects.requireNonNull(message, "message must not be null"));
        return new Session(id, ownerId, state, locked, jobContext, artifacts, history, createdAt, now);
    }
}
