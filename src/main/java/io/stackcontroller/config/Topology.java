package io.stackcontroller.config;

import io.stackcontroller.models.ServiceNode;

import java.util.List;
import java.util.Map;

/**
 * One named deployment profile: its service nodes and the nodes each tier's workers and
 * scheduler wait for.
 */
public record Topology(String profile, List<ServiceNode> nodes, Map<String, List<String>> tierRequirements) {

    public List<String> requirementsOf(String tierId) {
        return tierRequirements.getOrDefault(tierId, List.of());
    }
}
