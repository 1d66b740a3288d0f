package com.bulwark.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tally of how checks moved against the baseline and how many actions
 * each priority received.
 */
public record ComparisonSummary(
    int improved,
    int declined,
    int unchanged,
    int missing,
    int highPriorityActions,
    int mediumPriorityActions
) {

    public static ComparisonSummary of(List<CheckComparison> comparisons, List<PriorityAction> actions) {
        return new ComparisonSummary(
                count(comparisons, ComparisonStatus.IMPROVED),
                count(comparisons, ComparisonStatus.DECLINED),
                count(comparisons, ComparisonStatus.UNCHANGED),
                count(comparisons, ComparisonStatus.MISSING),
                (int) actions.stream().filter(a -> a.priority() == Priority.HIGH).count(),
                (int) actions.stream().filter(a -> a.priority() == Priority.MEDIUM).count());
    }

    private static int count(List<CheckComparison> comparisons, ComparisonStatus status) {
        return (int) comparisons.stream().filter(c -> c.status() == status).count();
    }

    /** JSON form; key names are part of the report contract. */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("improved_checks", improved);
        map.put("declined_checks", declined);
        map.put("unchanged_checks", unchanged);
        map.put("missing_checks", missing);
        map.put("high_priority_actions", highPriorityActions);
        map.put("medium_priority_actions", mediumPriorityActions);
        return map;
    }
}
