package com.phillippitts.cvtailor.domain;

import java.time.Instant;

/**
 * Lightweight status view for polling clients.
 *
 * @param partialFailure taken from the result bundle of the latest assistant message, if any
 */
public record SessionStatus(
        String sessionId,
        SessionState state,
        boolean locked,
        boolean partialFailure,
        int messageCount,
        Instant updatedAt
) {
    public static SessionStatus of(Session session) {
        boolean partial = false;
        for (int i = session.chatHistory().size() - 1; i >= 0; i--) {
            ChatMessage message = session.chatHistory().get(i);
            if (message.role() == ChatRole.ASSISTANT && message.result() != null) {
                partial = message.result().partialFailure();
                break;
            }
        }
        return new SessionStatus(session.id(), session.state(), session.locked(), partial,
                session.chatHistory().size(), session.updatedAt());
    }
}
