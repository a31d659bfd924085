package dev.evalforge.analysis;

import org.jspecify.annotations.Nullable;

/**
 * A rule the output of a prompt should follow.
 *
 * @param type format, length, value or pattern
 * @param description human-readable description
 * @param rule the rule itself, shape depends on {@code type}
 * @param severity error, warning or info
 */
public record Constraint(
    String type, String description, @Nullable Object rule, @Nullable String severity) {}
