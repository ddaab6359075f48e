package com.phillippitts.cvtailor.presentation.dto;

/**
 * Body of {@code POST /api/generate}.
 *
 * @param input       pasted job description or a link to the posting
 * @param sessionId   session to regenerate; omit for a new session
 * @param coverLetter generate a cover letter (default true)
 * @param coldEmail   generate a cold email (default true)
 */
public record GenerateRequest(String input, String sessionId, Boolean coverLetter, Boolean coldEmail) {
}
