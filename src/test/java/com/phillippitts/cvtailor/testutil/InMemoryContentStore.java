package com.phillippitts.cvtailor.testutil;

import com.phillippitts.cvtailor.service.storage.ContentStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Map-backed {@link ContentStore} for hermetic service tests.
 */
public class InMemoryContentStore implements ContentStore {

    private final Map<String, byte[]> objects = new ConcurrentSkipListMap<>();

    @Override
    public void write(String path, byte[] content) {
        objects.put(path, content.clone());
    }

    @Override
    public Optional<byte[]> read(String path) {
        byte[] content = objects.get(path);
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    @Override
    public boolean exists(String path) {
        return objects.containsKey(path);
    }

    @Override
    public List<String> list(String prefix) {
        String dir = prefix.endsWith("/") ? prefix : prefix + "/";
        return objects.keySet().stream()
                .filter(key -> key.startsWith(dir))
                .map(key -> key.substring(dir.length()))
                .map(rest -> rest.contains("/") ? rest.substring(0, rest.indexOf('/')) : rest)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String path) {
        return objects.remove(path) != null;
    }

    public List<String> paths() {
        return List.copyOf(objects.keySet());
    }

    public List<String> pathsUnder(String prefix) {
        return objects.keySet().stream().filter(key -> key.startsWith(prefix)).collect(Collectors.toList());
    }
}
