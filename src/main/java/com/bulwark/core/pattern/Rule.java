package com.bulwark.core.pattern;

import java.util.regex.Pattern;

/**
 * A deduction rule: a case-insensitive regex, the label reported when it
 * matches, and the number of points each match costs.
 *
 * @param pattern     compiled, case-insensitive pattern
 * @param description label used in issue messages (e.g. "Hardcoded token")
 * @param weight      points deducted per matching file
 * @param safeMarker  substring whose presence anywhere in the file suppresses the
 *                    rule, or {@code null} for no suppression
 */
public record Rule(
    Pattern pattern,
    String description,
    int weight,
    String safeMarker
) {
    public static Rule of(String regex, String description, int weight) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description, weight, null);
    }

    public Rule withSafeMarker(String marker) {
        return new Rule(pattern, description, weight, marker);
    }
}
