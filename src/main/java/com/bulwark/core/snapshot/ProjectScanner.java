package com.bulwark.core.snapshot;

import com.bulwark.core.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Walks a project directory and builds a {@link FileSystemSnapshot} of its
 * regular files.
 * <p>
 * Build-tool and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded when they sit directly under the project root
 * or under a component root. Deeper directories with the same names, such as
 * {@code mcp-server/src/out}, are scanned. The list is configurable through
 * {@code bulwark.ignore-dirs}.
 */
@Service
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(
            ".DS_Store", "Thumbs.db"
    );

    private final Set<String> ignoreDirs;

    public ProjectScanner(AuditProperties properties) {
        this.ignoreDirs = Set.copyOf(properties.getIgnoreDirs());
    }

    /**
     * Scans the given project root.
     *
     * @param projectRoot the root directory of the target project
     * @param components  component name to sub-root, relative to {@code projectRoot}
     * @return a snapshot over every non-ignored regular file, sorted by path
     * @throws IOException if the root is not a directory or the walk fails
     */
    public ProjectSnapshot scan(Path projectRoot, Map<String, String> components) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }

        var bases = ignoreBases(root, components);
        var files = new ArrayList<String>();
        try (var stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                  .map(p -> toRelative(root, p))
                  .filter(relative -> !shouldIgnore(relative, bases))
                  .forEach(files::add);
        }
        files.sort(null);

        log.info("Scanned {}: {} files, components {}", root, files.size(), components);
        return new FileSystemSnapshot(root, components, files);
    }

    /**
     * Path prefixes whose first child directory is checked against the
     * ignore list: the project root ({@code ""}) plus every component root
     * inside it, each ending in {@code /}.
     */
    private static Set<String> ignoreBases(Path root, Map<String, String> components) {
        var bases = new LinkedHashSet<String>();
        bases.add("");
        for (String subRoot : components.values()) {
            Path componentRoot = root.resolve(subRoot).normalize();
            if (!componentRoot.startsWith(root)) {
                continue;
            }
            String relative = toRelative(root, componentRoot);
            bases.add(relative.isEmpty() ? "" : relative + "/");
        }
        return bases;
    }

    /**
     * Returns {@code true} for ignored file names, and for files inside an
     * ignored directory that is a direct child of one of the bases.
     */
    private boolean shouldIgnore(String relative, Set<String> bases) {
        String fileName = relative.substring(relative.lastIndexOf('/') + 1);
        if (IGNORE_FILES.contains(fileName)) return true;
        for (String base : bases) {
            if (!relative.startsWith(base)) continue;
            String rest = relative.substring(base.length());
            int slash = rest.indexOf('/');
            if (slash > 0 && ignoreDirs.contains(rest.substring(0, slash))) return true;
        }
        return false;
    }

    private static String toRelative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
