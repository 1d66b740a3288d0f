package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.snapshot.ProjectSnapshot;
import com.bulwark.core.snapshot.SnapshotReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Base for the registered checks. Gives every evaluation its own
 * {@link IssueLog}, clamps the score, and provides the shared file helpers.
 * <p>
 * Per-file read failures never surface from the helpers: an unreadable or
 * undecodable file simply contributes nothing.
 */
public abstract class AbstractCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(AbstractCheck.class);

    private final String name;
    private final String displayName;

    protected AbstractCheck(String name, String displayName) {
        this.name = name;
        this.displayName = displayName;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public final CheckResult evaluate(ProjectSnapshot snapshot) {
        var issues = new IssueLog();
        int score = score(snapshot, issues);
        return new CheckResult(name, displayName, score, issues.issues(), issues.recommendations());
    }

    /**
     * Computes the raw score, recording findings in {@code issues}. The result
     * is clamped by {@link CheckResult}.
     */
    protected abstract int score(ProjectSnapshot snapshot, IssueLog issues);

    protected Optional<String> readQuietly(ProjectSnapshot snapshot, String path) {
        try {
            return Optional.of(snapshot.read(path));
        } catch (SnapshotReadException e) {
            log.debug("Skipping {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Files matched by the targets, in target order, each listed once.
     */
    protected List<String> filesFor(ProjectSnapshot snapshot, List<CheckRules.ScanTarget> targets) {
        var files = new LinkedHashSet<String>();
        for (var target : targets) {
            files.addAll(snapshot.find(snapshot.resolve(target.component(), target.path())));
        }
        return List.copyOf(files);
    }

    /**
     * Returns {@code true} if any candidate file of the component satisfies the probe.
     */
    protected boolean probe(ProjectSnapshot snapshot, String component, MarkerProbe probe) {
        for (String candidate : probe.candidates()) {
            for (String file : snapshot.find(snapshot.resolve(component, candidate))) {
                if (readQuietly(snapshot, file).map(probe::matches).orElse(false)) {
                    return true;
                }
            }
        }
        return false;
    }
}
