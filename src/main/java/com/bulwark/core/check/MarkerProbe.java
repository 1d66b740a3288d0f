package com.bulwark.core.check;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Declarative presence test: a capability counts as configured when any
 * candidate file contains the markers.
 *
 * @param candidates globs relative to a component sub-root, tried in order
 * @param markers    substrings to look for
 * @param mode       whether any single marker or all markers must appear
 * @param ignoreCase compare against the lower-cased content
 */
public record MarkerProbe(
    List<String> candidates,
    List<String> markers,
    MatchMode mode,
    boolean ignoreCase
) {
    public enum MatchMode { ANY, ALL }

    public MarkerProbe {
        candidates = List.copyOf(candidates);
        markers = List.copyOf(markers);
    }

    public static MarkerProbe anyOf(List<String> candidates, String... markers) {
        return new MarkerProbe(candidates, List.of(markers), MatchMode.ANY, false);
    }

    public static MarkerProbe anyOfIgnoringCase(List<String> candidates, String... markers) {
        return new MarkerProbe(candidates, List.of(markers), MatchMode.ANY, true);
    }

    public static MarkerProbe allOfIgnoringCase(List<String> candidates, String... markers) {
        return new MarkerProbe(candidates, List.of(markers), MatchMode.ALL, true);
    }

    public boolean matches(String content) {
        if (content == null) {
            return false;
        }
        String haystack = ignoreCase ? content.toLowerCase(Locale.ROOT) : content;
        Predicate<String> present = marker ->
                haystack.contains(ignoreCase ? marker.toLowerCase(Locale.ROOT) : marker);
        return mode == MatchMode.ANY
                ? markers.stream().anyMatch(present)
                : markers.stream().allMatch(present);
    }
}
