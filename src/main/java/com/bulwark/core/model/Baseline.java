package com.bulwark.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores from a previous run, used for regression ranking.
 * Iteration order of {@link #scores()} follows the source document.
 *
 * @param scores  check name to score
 * @param reasons check name to the reason recorded with the score (may be empty)
 */
public record Baseline(
    Map<String, Double> scores,
    Map<String, String> reasons
) {
    public Baseline {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        reasons = reasons != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(reasons))
                : Map.of();
    }

    public String reasonFor(String check) {
        return reasons.getOrDefault(check, "");
    }
}
