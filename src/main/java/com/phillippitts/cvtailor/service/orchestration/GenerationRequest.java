package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.domain.GenerationPreferences;

import java.util.Objects;

/**
 * Input of one generation run.
 *
 * @param input     pasted job description or a link to the posting
 * @param sessionId existing session to regenerate, or {@code null} for a new session
 */
public record GenerationRequest(String ownerId, String input, String sessionId, GenerationPreferences preferences) {

    public GenerationRequest {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        preferences = preferences == null ? GenerationPreferences.ALL : preferences;
        sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId.trim();
    }

    public static GenerationRequest newSession(String ownerId, String input) {
        return new GenerationRequest(ownerId, input, null, GenerationPreferences.ALL);
    }
}
