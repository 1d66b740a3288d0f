package com.bulwark.core.model;

/**
 * One check's current score set against its baseline score.
 *
 * @param check         check name
 * @param currentScore  score in the current run (0 when missing)
 * @param baselineScore score in the baseline (0 when the baseline lacks the check)
 * @param diff          {@code currentScore - baselineScore}
 * @param status        direction of the change
 * @param reason        short explanation of the current score
 * @param baselineReason reason recorded with the baseline score (empty when none)
 */
public record CheckComparison(
    String check,
    double currentScore,
    double baselineScore,
    double diff,
    ComparisonStatus status,
    String reason,
    String baselineReason
) {}
