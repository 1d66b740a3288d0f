package com.bulwark.core.model;

/**
 * Aggregate of all check scores for one run.
 *
 * @param total      sum of the per-check scores
 * @param max        {@code 10 × number of checks}
 * @param percentage {@code 100 × total / max}, or 0 when no checks ran
 * @param band       status band for {@code percentage}
 */
public record ScoreSummary(
    int total,
    int max,
    double percentage,
    StatusBand band
) {}
