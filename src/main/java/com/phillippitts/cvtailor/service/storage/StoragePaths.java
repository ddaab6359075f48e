package com.phillippitts.cvtailor.service.storage;

import com.phillippitts.cvtailor.exception.InputInvalidException;

import java.util.regex.Pattern;

/**
 * Content-store layout, namespaced per owner:
 *
 * <pre>
 * users/{owner}/sources/{file}
 * users/{owner}/sessions/{id}/session.json
 * users/{owner}/sessions/{id}/log.json
 * users/{owner}/sessions/{id}/generated/{file}
 * </pre>
 */
public final class StoragePaths {

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._@-]{0,127}");

    private StoragePaths() {
    }

    public static String sourcesDir(String ownerId) {
        return "users/" + segment(ownerId, "owner id") + "/sources";
    }

    public static String source(String ownerId, String fileName) {
        return sourcesDir(ownerId) + "/" + segment(fileName, "file name");
    }

    public static String sessionsDir(String ownerId) {
        return "users/" + segment(ownerId, "owner id") + "/sessions";
    }

    public static String sessionDir(String ownerId, String sessionId) {
        return sessionsDir(ownerId) + "/" + segment(sessionId, "session id");
    }

    public static String sessionFile(String ownerId, String sessionId) {
        return sessionDir(ownerId, sessionId) + "/session.json";
    }

    public static String logFile(String ownerId, String sessionId) {
        return sessionDir(ownerId, sessionId) + "/log.json";
    }

    public static String generated(String ownerId, String sessionId, String fileName) {
        return sessionDir(ownerId, sessionId) + "/generated/" + segment(fileName, "file name");
    }

    /**
     * Rejects anything that could escape its directory or is not a plain identifier.
     *
     * @throws InputInvalidException for unsafe segments
     */
    public static String segment(String value, String what) {
        if (value == null || !SAFE_SEGMENT.matcher(value).matches() || value.contains("..")) {
            throw new InputInvalidException("invalid " + what + " '" + value + "'");
        }
        return value;
    }
}
