package com.bulwark.core.model;

import java.util.List;

/**
 * One titled block of the human-readable report. Lines are Markdown-ready.
 */
public record ReportSection(
    String title,
    List<String> lines
) {
    public ReportSection {
        lines = List.copyOf(lines);
    }
}
