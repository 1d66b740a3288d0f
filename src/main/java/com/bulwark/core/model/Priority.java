package com.bulwark.core.model;

import java.util.Locale;

/**
 * Priority of a remediation action. Lower rank sorts first.
 */
public enum Priority {
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
