package io.stackcontroller.enums;

import java.util.Locale;

/**
 * Condition a dependency must reach before its dependent may start.
 */
public enum DependencyCondition {
    /**
     * Dependency has entered STARTING or later.
     */
    STARTED,

    /**
     * Dependency has entered HEALTHY.
     */
    HEALTHY;

    /**
     * Parse the configuration spelling. Accepts {@code started}, {@code healthy} and the
     * compose-style {@code service_started} / {@code service_healthy}.
     */
    public static DependencyCondition fromString(String value) {
        if (value == null || value.isBlank()) {
            return STARTED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("service_")) {
            normalized = normalized.substring("service_".length());
        }
        switch (normalized) {
            case "started":
                return STARTED;
            case "healthy":
                return HEALTHY;
            default:
                throw new IllegalArgumentException("Unknown dependency condition: " + value);
        }
    }

    public boolean isSatisfiedBy(NodeState state) {
        if (this == HEALTHY) {
            return state == NodeState.HEALTHY;
        }
        return state.hasStarted();
    }
}
