package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed severity scale for audit issues.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    WARNING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
