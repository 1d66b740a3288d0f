package com.bulwark.core.model;

import java.util.List;

/**
 * Outcome of a single check evaluation. The score is clamped to
 * [{@value #MIN_SCORE}, {@value #MAX_SCORE}] on construction.
 *
 * @param name            stable key used in reports (e.g. "file_permissions")
 * @param displayName     human-readable name (e.g. "File Permissions")
 * @param score           clamped check score
 * @param issues          issues emitted by this check, in emission order
 * @param recommendations recommendations emitted by this check, in emission order
 */
public record CheckResult(
    String name,
    String displayName,
    int score,
    List<Issue> issues,
    List<Recommendation> recommendations
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    public CheckResult {
        score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        issues = issues != null ? List.copyOf(issues) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /**
     * Result recorded for a check whose evaluation blew up.
     */
    public static CheckResult failed(String name, String displayName, Issue systemError) {
        return new CheckResult(name, displayName, MIN_SCORE, List.of(systemError), List.of());
    }
}
