package io.stackcontroller.models;

import io.stackcontroller.enums.DependencyCondition;

/**
 * Edge from a dependent node to the node it waits for, tagged with the condition to wait on.
 */
public record Dependency(String nodeName, DependencyCondition condition) {

    public Dependency {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("Dependency node name cannot be null or empty");
        }
        if (condition == null) {
            condition = DependencyCondition.STARTED;
        }
    }

    public static Dependency healthy(String nodeName) {
        return new Dependency(nodeName, DependencyCondition.HEALTHY);
    }

    public static Dependency started(String nodeName) {
        return new Dependency(nodeName, DependencyCondition.STARTED);
    }
}
