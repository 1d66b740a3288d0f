package com.bulwark.core.model;

/**
 * A ranked remediation item derived from a {@link CheckComparison}.
 */
public record PriorityAction(
    String check,
    Priority priority,
    ActionType action,
    double currentScore,
    double baselineScore,
    double diff,
    String reason
) {}
