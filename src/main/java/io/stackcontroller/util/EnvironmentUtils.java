package io.stackcontroller.util;

import java.util.Map;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value. Blank values count as unset.
     */
    public static String getEnv(Map<String, String> environment, String name, String defaultValue) {
        String value = environment.get(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    /**
     * Expand {@code ${NAME}} and {@code ${NAME:-default}} references against the environment.
     * Unknown names without a default expand to the empty string.
     */
    public static String expand(String template, Map<String, String> environment) {
        if (template == null || !template.contains("${")) {
            return template;
        }
        StringBuilder out = new StringBuilder();
        int pos = 0;
        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start < 0) {
                out.append(template, pos, template.length());
                break;
            }
            int end = template.indexOf('}', start);
            if (end < 0) {
                out.append(template, pos, template.length());
                break;
            }
            out.append(template, pos, start);
            String reference = template.substring(start + 2, end);
            String name = reference;
            String fallback = "";
            int sep = reference.indexOf(":-");
            if (sep >= 0) {
                name = reference.substring(0, sep);
                fallback = reference.substring(sep + 2);
            }
            out.append(getEnv(environment, name, fallback));
            pos = end + 1;
        }
        return out.toString();
    }
}
