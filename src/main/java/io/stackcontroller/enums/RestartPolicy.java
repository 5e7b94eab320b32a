package io.stackcontroller.enums;

import java.util.Locale;

/**
 * What the orchestrator does with a node whose health check failed.
 */
public enum RestartPolicy {
    /**
     * Re-enter PENDING and retry the whole start cycle with capped exponential backoff.
     */
    ALWAYS,

    /**
     * Propagate the failure; the plan halts if the node never became healthy.
     */
    NONE;

    public static RestartPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "always":
            case "unless-stopped":
            case "on-failure":
                return ALWAYS;
            case "none":
            case "no":
                return NONE;
            default:
                throw new IllegalArgumentException("Unknown restart policy: " + value);
        }
    }
}
