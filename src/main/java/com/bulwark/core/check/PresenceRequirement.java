package com.bulwark.core.check;

import com.bulwark.core.model.Severity;

import java.util.List;

/**
 * One independently verifiable sub-condition of a presence check. The
 * requirement is met when any of its probes succeeds against the component;
 * otherwise an issue with the given severity and text is emitted.
 *
 * @param component      component whose sub-root the probes are resolved against
 * @param label          name used in progress logging, e.g. "Bridge"
 * @param probes         alternative probes, tried in order
 * @param weight         points awarded when the requirement is met
 * @param issueComponent component reported on the issue, e.g. "MCPAuth"
 * @param severity       severity of the gap
 * @param message        issue message
 * @param recommendation issue recommendation
 */
public record PresenceRequirement(
    String component,
    String label,
    List<MarkerProbe> probes,
    int weight,
    String issueComponent,
    Severity severity,
    String message,
    String recommendation
) {
    public PresenceRequirement {
        probes = List.copyOf(probes);
    }
}
