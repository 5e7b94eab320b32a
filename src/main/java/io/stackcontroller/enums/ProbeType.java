package io.stackcontroller.enums;

import java.util.Locale;

/**
 * Protocol a health check speaks to its node.
 */
public enum ProbeType {
    /** Run a command; exit code 0 is healthy. */
    COMMAND,
    /** HTTP GET; 2xx and 3xx are healthy. */
    HTTP,
    /** TCP connect succeeds. */
    TCP;

    public static ProbeType fromString(String value) {
        if (value == null || value.isBlank()) {
            return COMMAND;
        }
        return ProbeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
