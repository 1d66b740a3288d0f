package com.bulwark.core.model;

/**
 * A located security gap emitted by a check.
 *
 * @param component      logical area the finding belongs to (e.g. "HardcodedSecrets", "MCPAuth")
 * @param severity       how urgent the gap is
 * @param message        what was found
 * @param recommendation how to fix it; empty when the emitter has no advice
 */
public record Issue(
    String component,
    Severity severity,
    String message,
    String recommendation
) {
    public Issue {
        recommendation = recommendation != null ? recommendation : "";
    }
}
