package io.stackcontroller.orchestration;

import java.util.List;

/**
 * Thrown at plan-build time when the dependency relation is not acyclic.
 * Carries the whole cycle, first node repeated at the end.
 */
public class DependencyCycleException extends RuntimeException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
