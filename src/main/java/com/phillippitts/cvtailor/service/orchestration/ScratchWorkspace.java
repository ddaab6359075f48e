package com.phillippitts.cvtailor.service.orchestration;

import com.phillippitts.cvtailor.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Private temporary directory for one run's compiler inputs and outputs.
 * Closing removes the directory and everything in it.
 */
public final class ScratchWorkspace implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ScratchWorkspace.class);

    private final Path directory;

    private ScratchWorkspace(Path directory) {
        this.directory = directory;
    }

    /**
     * @throws StorageException if the directory cannot be created
     */
    public static ScratchWorkspace create(Path root, String label) {
        try {
            Files.createDirectories(root);
            return new ScratchWorkspace(Files.createTempDirectory(root, "run-" + label + "-"));
        } catch (IOException e) {
            throw new StorageException("Failed to create scratch workspace", root.toString(), e);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    public Path write(String fileName, String content) {
        Path file = resolve(fileName);
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new StorageException("Failed to write scratch file", file.toString(), e);
        }
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Failed to list scratch workspace {}: {}", directory, e.toString());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.warn("Failed to delete scratch path {}: {}", path, e.toString());
            }
        }
    }
}
