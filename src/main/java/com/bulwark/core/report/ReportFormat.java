package com.bulwark.core.report;

import java.util.Locale;

public enum ReportFormat {
    JSON,
    MARKDOWN;

    /**
     * Case-insensitive lookup used by the command line; {@code md} is
     * accepted for Markdown.
     */
    public static ReportFormat fromString(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("md".equals(v)) {
            return MARKDOWN;
        }
        return valueOf(v.toUpperCase(Locale.ROOT));
    }
}
