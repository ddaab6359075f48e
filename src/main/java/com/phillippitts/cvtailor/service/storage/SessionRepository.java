package com.phillippitts.cvtailor.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.phillippitts.cvtailor.domain.LogLine;
import com.phillippitts.cvtailor.domain.Session;
import com.phillippitts.cvtailor.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists sessions and run logs as JSON documents in the {@link ContentStore}.
 *
 * <p>No locking here. Callers that read-modify-write go through {@code SessionStateMachine}.
 */
@Component
public class SessionRepository {

    private static final Logger LOG = LogManager.getLogger(SessionRepository.class);
    private static final TypeReference<List<LogLine>> LOG_LINES = new TypeReference<>() {
    };

    private final ContentStore store;
    private final ObjectMapper mapper;

    public SessionRepository(ContentStore store, ObjectMapper objectMapper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null").copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(Session session) {
        String path = StoragePaths.sessionFile(session.ownerId(), session.id());
        store.write(path, toJson(session, path));
    }

    public Optional<Session> find(String ownerId, String sessionId) {
        String path = StoragePaths.sessionFile(ownerId, sessionId);
        return store.read(path).map(bytes -> fromJson(bytes, Session.class, path));
    }

    /**
     * All sessions of one owner, newest first. Unreadable entries are skipped with a warning.
     */
    public List<Session> findAll(String ownerId) {
        List<Session> sessions = new ArrayList<>();
        for (String id : store.list(StoragePaths.sessionsDir(ownerId))) {
            try {
                find(ownerId, id).ifPresent(sessions::add);
            } catch (StorageException e) {
                LOG.warn("Skipping unreadable session {}: {}", id, e.getMessage());
            }
        }
        sessions.sort((a, b) -> b.createdAt().compareTo(a.createdAt()));
        return sessions;
    }

    public void saveLog(String ownerId, String sessionId, List<LogLine> lines) {
        String path = StoragePaths.logFile(ownerId, sessionId);
        store.write(path, toJson(lines, path));
    }

    public List<LogLine> findLog(String ownerId, String sessionId) {
        String path = StoragePaths.logFile(ownerId, sessionId);
        return store.read(path).map(bytes -> {
            try {
                return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), LOG_LINES);
            } catch (JsonProcessingException e) {
                throw new StorageException("Corrupt log document", path, e);
            }
        }).orElse(List.of());
    }

    private byte[] toJson(Object value, String path) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize", path, e);
        }
    }

    private <T> T fromJson(byte[] bytes, Class<T> type, String path) {
        try {
            return mapper.readValue(bytes, type);
        } catch (java.io.IOException e) {
            throw new StorageException("Corrupt session document", path, e);
        }
    }
}
