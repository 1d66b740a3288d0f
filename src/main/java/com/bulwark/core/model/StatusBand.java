package com.bulwark.core.model;

import java.util.Locale;

/**
 * Qualitative label for an overall percentage. Lower bounds are inclusive
 * and the bands partition [0, 100] without overlap.
 */
public enum StatusBand {
    EXCELLENT(90.0, "Security configuration is outstanding"),
    GOOD(80.0, "Security configuration is solid"),
    FAIR(70.0, "Security configuration needs some improvements"),
    POOR(60.0, "Security configuration has significant issues"),
    CRITICAL(Double.NEGATIVE_INFINITY, "Security configuration needs immediate attention");

    private final double lowerBound;
    private final String verdict;

    StatusBand(double lowerBound, String verdict) {
        this.lowerBound = lowerBound;
        this.verdict = verdict;
    }

    public String verdict() {
        return verdict;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StatusBand forPercentage(double percentage) {
        for (StatusBand band : values()) {
            if (percentage >= band.lowerBound) {
                return band;
            }
        }
        return CRITICAL;
    }
}
