package com.phillippitts.cvtailor.service.storage;

import com.phillippitts.cvtailor.exception.StorageException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Hierarchical blob store addressed by {@code /}-separated relative paths.
 *
 * <p>Writes are whole-object replacements. Implementations must be thread-safe.
 *
 * @see StoragePaths
 */
public interface ContentStore {

    /**
     * @throws StorageException if the object cannot be written
     */
    void write(String path, byte[] content);

    default void writeText(String path, String text) {
        write(path, text.getBytes(StandardCharsets.UTF_8));
    }

    Optional<byte[]> read(String path);

    default Optional<String> readText(String path) {
        return read(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    boolean exists(String path);

    /**
     * Names of the immediate children under {@code prefix}, sorted. Empty if the prefix is absent.
     */
    List<String> list(String prefix);

    /**
     * @return {@code true} if an object was removed
     */
    boolean delete(String path);
}
