package com.bulwark.core.model;

import java.util.Locale;

/**
 * How a check's score moved relative to the baseline.
 */
public enum ComparisonStatus {
    IMPROVED,
    DECLINED,
    UNCHANGED,
    MISSING;       // present in the baseline, absent from the current run

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
