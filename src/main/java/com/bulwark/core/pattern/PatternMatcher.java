package com.bulwark.core.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies {@link Rule}s to file contents.
 * <p>
 * A rule matches when its pattern is found anywhere in the content and its
 * safe marker (if any) does not appear anywhere in the same content. The
 * marker test is a plain case-sensitive substring check and is not tied to
 * the location of the match.
 */
public final class PatternMatcher {

    private PatternMatcher() {} // utility class

    /**
     * Returns the rules that match the content, in rule order.
     *
     * @param content file text; {@code null} or empty content matches nothing
     * @param rules   rules to apply
     */
    public static List<Rule> match(String content, List<Rule> rules) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        var matched = new ArrayList<Rule>();
        for (Rule rule : rules) {
            if (matches(content, rule)) {
                matched.add(rule);
            }
        }
        return matched;
    }

    /**
     * Returns the descriptions of the matching rules.
     */
    public static List<String> matchLabels(String content, List<Rule> rules) {
        return match(content, rules).stream().map(Rule::description).toList();
    }

    private static boolean matches(String content, Rule rule) {
        if (!rule.pattern().matcher(content).find()) {
            return false;
        }
        return rule.safeMarker() == null || !content.contains(rule.safeMarker());
    }
}
