package com.bulwark.core.model;

/**
 * Advisory suggestion emitted by a check. Unlike an {@link Issue} it carries no severity.
 */
public record Recommendation(
    String component,
    String message
) {}
