package com.bulwark.core.snapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link ProjectSnapshot} backed by the local file system.
 * <p>
 * File contents are cached after the first successful read; the cache is
 * never invalidated, since a snapshot lives for a single audit run.
 */
public class FileSystemSnapshot implements ProjectSnapshot {

    private final Path root;
    private final Map<String, String> components;
    private final List<String> files;
    private final Map<String, String> contentCache = new HashMap<>();

    public FileSystemSnapshot(Path root, Map<String, String> components, List<String> files) {
        this.root = root;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.files = List.copyOf(files);
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Map<String, String> components() {
        return components;
    }

    @Override
    public List<String> files() {
        return files;
    }

    @Override
    public boolean exists(String relativePath) {
        return Files.exists(root.resolve(relativePath));
    }

    @Override
    public String read(String relativePath) throws SnapshotReadException {
        String cached = contentCache.get(relativePath);
        if (cached != null) {
            return cached;
        }
        try {
            String content = Files.readString(root.resolve(relativePath), StandardCharsets.UTF_8);
            contentCache.put(relativePath, content);
            return content;
        } catch (IOException e) {
            throw new SnapshotReadException("Unable to read " + relativePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Set<PosixFilePermission> permissions(String relativePath) throws SnapshotReadException {
        try {
            return Files.getPosixFilePermissions(root.resolve(relativePath));
        } catch (IOException | UnsupportedOperationException e) {
            throw new SnapshotReadException("Unable to read permissions of " + relativePath, e);
        }
    }
}
