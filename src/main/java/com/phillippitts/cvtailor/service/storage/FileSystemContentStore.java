package com.phillippitts.cvtailor.service.storage;

import com.phillippitts.cvtailor.config.properties.StorageProperties;
import com.phillippitts.cvtailor.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ContentStore} on the local file system. Writes go to a sibling temp file and are
 * moved into place, so readers never observe a partially written object.
 */
@Component
public class FileSystemContentStore implements ContentStore {

    private static final Logger LOG = LogManager.getLogger(FileSystemContentStore.class);

    private final Path root;

    @Autowired
    public FileSystemContentStore(StorageProperties properties) {
        this(Path.of(properties.getRoot()));
    }

    public FileSystemContentStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void write(String path, byte[] content) {
        Path target = resolve(path);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
            Files.write(temp, content);
            moveIntoPlace(temp, target);
            LOG.debug("Stored {} ({} bytes)", path, content.length);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to write", path, e);
        }
    }

    @Override
    public Optional<byte[]> read(String path) {
        Path target = resolve(path);
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read", path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public List<String> list(String prefix) {
        Path dir = resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children.map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith(".tmp-"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list", prefix, e);
        }
    }

    @Override
    public boolean delete(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new StorageException("Failed to delete", path, e);
        }
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("path escapes content store root: " + path);
        }
        return resolved;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", temp, e.toString());
        }
    }
}
