package com.phillippitts.cvtailor.service.progress;

public record SessionAnnouncement(String sessionId) {
}
