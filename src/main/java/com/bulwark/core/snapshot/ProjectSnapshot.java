package com.bulwark.core.snapshot;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of the project under audit.
 * <p>
 * All paths are relative to {@link #root()} and use {@code /} as separator.
 * Components are named sub-roots (e.g. {@code bridge -> "."},
 * {@code server -> "mcp-server"}) that checks address by name.
 */
public interface ProjectSnapshot {

    Path root();

    /** Component name to sub-root, relative to {@link #root()}. */
    Map<String, String> components();

    /** Every regular file in the snapshot, sorted. */
    List<String> files();

    /** Returns {@code true} if a file or directory exists at the given path. */
    boolean exists(String relativePath);

    /**
     * Returns the file's text content.
     *
     * @throws SnapshotReadException if the file is missing, unreadable, or not valid UTF-8
     */
    String read(String relativePath) throws SnapshotReadException;

    /**
     * Returns the file's POSIX permissions.
     *
     * @throws SnapshotReadException if the file system has no POSIX view or the lookup fails
     */
    Set<PosixFilePermission> permissions(String relativePath) throws SnapshotReadException;

    /**
     * Joins a component sub-root with a path inside it. Unknown components are
     * treated as a sub-root of the same name.
     */
    default String resolve(String component, String relativePath) {
        String base = components().getOrDefault(component, component);
        if (base == null || base.isEmpty() || ".".equals(base)) {
            return relativePath;
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + relativePath;
    }

    /**
     * Returns the files matching a glob, in {@link #files()} order. {@code **}
     * crosses directory boundaries, so {@code src/**.rs} covers {@code src/main.rs}
     * as well as {@code src/utils/security.rs}.
     */
    default List<String> find(String glob) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        return files().stream()
                .filter(file -> matcher.matches(Paths.get(file)))
                .toList();
    }

    default Path absolute(String relativePath) {
        return root().resolve(relativePath);
    }
}
