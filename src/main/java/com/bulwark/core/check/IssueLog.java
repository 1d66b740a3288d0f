package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Recommendation;
import com.bulwark.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Append-only collector of issues and recommendations.
 * <p>
 * Each check writes to its own log during evaluation; the runner merges the
 * per-check results into a run-level log in registration order, which keeps
 * the output ordering deterministic. Not thread-safe.
 */
public class IssueLog {

    private static final Logger log = LoggerFactory.getLogger(IssueLog.class);

    private final List<Issue> issues = new ArrayList<>();
    private final List<Recommendation> recommendations = new ArrayList<>();

    public Issue issue(String component, Severity severity, String message, String recommendation) {
        var issue = new Issue(component, severity, message, recommendation);
        log.warn("[{}] {}: {}", severity.label().toUpperCase(Locale.ROOT), component, message);
        issues.add(issue);
        return issue;
    }

    public Recommendation recommend(String component, String message) {
        var recommendation = new Recommendation(component, message);
        log.info("[RECOMMENDATION] {}: {}", component, message);
        recommendations.add(recommendation);
        return recommendation;
    }

    /**
     * Appends everything a finished check emitted, without logging it again.
     */
    public void append(CheckResult result) {
        issues.addAll(result.issues());
        recommendations.addAll(result.recommendations());
    }

    public List<Issue> issues() {
        return List.copyOf(issues);
    }

    public List<Recommendation> recommendations() {
        return List.copyOf(recommendations);
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }
}
