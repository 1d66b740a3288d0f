package com.bulwark.core.model;

import java.util.Locale;

/**
 * Kind of remediation the ranker asks for.
 */
public enum ActionType {
    INVESTIGATE_DECLINE,
    RESTORE_CHECK,
    IMPROVE_SECURITY;

    /** Wire name, e.g. {@code "restore_check"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Heading form, e.g. {@code "Restore Check"}. */
    public String title() {
        var words = name().toLowerCase(Locale.ROOT).split("_");
        var sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
