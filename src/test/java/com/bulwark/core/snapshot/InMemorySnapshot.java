package com.bulwark.core.snapshot;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory {@link ProjectSnapshot} for tests. Directories exist implicitly
 * when a file lives under them; {@link #directory(String)} adds an empty one.
 */
public class InMemorySnapshot implements ProjectSnapshot {

    private final Path root = Path.of("/work/project");
    private final Map<String, String> components = new LinkedHashMap<>();
    private final Map<String, String> contents = new TreeMap<>();
    private final Map<String, Set<PosixFilePermission>> permissions = new HashMap<>();
    private final Set<String> unreadable = new HashSet<>();
    private final Set<String> directories = new HashSet<>();

    public InMemorySnapshot() {
        components.put("bridge", ".");
        components.put("server", "mcp-server");
    }

    public InMemorySnapshot file(String path, String content) {
        contents.put(path, content);
        return this;
    }

    public InMemorySnapshot file(String path, String content, String posix) {
        contents.put(path, content);
        permissions.put(path, PosixFilePermissions.fromString(posix));
        return this;
    }

    /** A file that is listed but whose content cannot be read. */
    public InMemorySnapshot unreadable(String path) {
        contents.put(path, "");
        unreadable.add(path);
        return this;
    }

    public InMemorySnapshot directory(String path) {
        directories.add(path);
        return this;
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
        return new ArrayList<>(contents.keySet());
    }

    @Override
    public boolean exists(String relativePath) {
        if (contents.containsKey(relativePath) || directories.contains(relativePath)) {
            return true;
        }
        String prefix = relativePath + "/";
        return contents.keySet().stream().anyMatch(p -> p.startsWith(prefix));
    }

    @Override
    public String read(String relativePath) throws SnapshotReadException {
        if (unreadable.contains(relativePath) || !contents.containsKey(relativePath)) {
            throw new SnapshotReadException("Unable to read " + relativePath);
        }
        return contents.get(relativePath);
    }

    @Override
    public Set<PosixFilePermission> permissions(String relativePath) throws SnapshotReadException {
        var result = permissions.get(relativePath);
        if (result == null) {
            throw new SnapshotReadException("No permissions for " + relativePath);
        }
        return result;
    }
}
