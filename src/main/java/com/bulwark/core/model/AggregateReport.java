package com.bulwark.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, read-only verdict of an audit run.
 * <p>
 * Exposes two rendering contracts over the same data:
 * <ul>
 *   <li>{@link #sections()}: ordered human-readable sections (summary, check table,
 *       priority actions, detailed findings)</li>
 *   <li>{@link #toMap()}: nested ordered map with stable keys for JSON output</li>
 * </ul>
 *
 * @param timestamp       when the report was assembled
 * @param results         per-check results keyed by check name, in registration order
 * @param summary         aggregated score
 * @param issues          every issue from every check, in registration then emission order
 * @param recommendations every recommendation, same ordering as {@code issues}
 * @param comparisons     per-check baseline comparisons
 * @param actions         ranked remediation actions
 * @param sections        human-readable rendering
 */
public record AggregateReport(
    Instant timestamp,
    Map<String, CheckResult> results,
    ScoreSummary summary,
    List<Issue> issues,
    List<Recommendation> recommendations,
    List<CheckComparison> comparisons,
    List<PriorityAction> actions,
    List<ReportSection> sections
) {
    public AggregateReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
        comparisons = List.copyOf(comparisons);
        actions = List.copyOf(actions);
        sections = List.copyOf(sections);
    }

    public int totalScore() {
        return summary.total();
    }

    public int maxScore() {
        return summary.max();
    }

    public double percentage() {
        return summary.percentage();
    }

    public StatusBand band() {
        return summary.band();
    }

    /** Check name to score, in registration order. */
    public Map<String, Integer> scores() {
        var scores = new LinkedHashMap<String, Integer>();
        results.forEach((name, result) -> scores.put(name, result.score()));
        return Collections.unmodifiableMap(scores);
    }

    public ComparisonSummary comparisonSummary() {
        return ComparisonSummary.of(comparisons, actions);
    }

    public List<Issue> criticalIssues() {
        return issues.stream()
                .filter(issue -> issue.severity() == Severity.CRITICAL)
                .toList();
    }

    /**
     * Machine-readable form. Key names are part of the output contract.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("timestamp", timestamp.toString());
        map.put("overall_status", band().label());
        map.put("scores", new LinkedHashMap<>(scores()));

        var issueMaps = new ArrayList<Map<String, Object>>();
        for (Issue issue : issues) {
            var m = new LinkedHashMap<String, Object>();
            m.put("component", issue.component());
            m.put("severity", issue.severity().label());
            m.put("message", issue.message());
            m.put("recommendation", issue.recommendation());
            issueMaps.add(m);
        }
        map.put("issues", issueMaps);

        var recommendationMaps = new ArrayList<Map<String, Object>>();
        for (Recommendation recommendation : recommendations) {
            var m = new LinkedHashMap<String, Object>();
            m.put("component", recommendation.component());
            m.put("message", recommendation.message());
            recommendationMaps.add(m);
        }
        map.put("recommendations", recommendationMaps);

        map.put("overall_score", totalScore());
        map.put("max_score", maxScore());
        map.put("percentage", percentage());

        var actionMaps = new ArrayList<Map<String, Object>>();
        for (PriorityAction action : actions) {
            var m = new LinkedHashMap<String, Object>();
            m.put("check", action.check());
            m.put("priority", action.priority().label());
            m.put("action", action.action().label());
            m.put("current_score", action.currentScore());
            m.put("baseline_score", action.baselineScore());
            m.put("diff", action.diff());
            m.put("reason", action.reason());
            actionMaps.add(m);
        }
        map.put("priority_actions", actionMaps);
        map.put("summary", comparisonSummary().toMap());
        return map;
    }
}
