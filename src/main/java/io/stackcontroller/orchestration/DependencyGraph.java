package io.stackcontroller.orchestration;

import io.stackcontroller.models.Dependency;
import io.stackcontroller.models.ServiceNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed acyclic graph of service nodes keyed by name.
 *
 * Built once per plan. Construction validates that every dependency names a known node and
 * that no cycle exists; the resulting start order is deterministic (alphabetical among nodes
 * whose dependencies are already ordered) and independent of declaration order.
 */
@Slf4j
public class DependencyGraph {

    private final Map<String, ServiceNode> nodes;
    private final Map<String, Set<String>> dependents;
    private final List<List<String>> layers;

    private DependencyGraph(Map<String, ServiceNode> nodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.dependents = buildDependents(nodes);
        this.layers = computeLayers(nodes);
    }

    /**
     * Build and validate the graph.
     *
     * @throws DependencyCycleException if the dependency relation contains a cycle
     * @throws IllegalArgumentException on duplicate names or unknown dependencies
     */
    public static DependencyGraph build(Collection<ServiceNode> serviceNodes) {
        Map<String, ServiceNode> byName = new TreeMap<>();
        for (ServiceNode node : serviceNodes) {
            if (node.getName() == null || node.getName().isBlank()) {
                throw new IllegalArgumentException("Service node name cannot be null or empty");
            }
            if (byName.put(node.getName(), node) != null) {
                throw new IllegalArgumentException("Duplicate service node: " + node.getName());
            }
            if (node.getHealthCheck() != null) {
                node.getHealthCheck().validate(node.getName());
            }
        }
        for (ServiceNode node : byName.values()) {
            Set<String> seen = new LinkedHashSet<>();
            for (Dependency dependency : node.getDependencies()) {
                if (!byName.containsKey(dependency.nodeName())) {
                    throw new IllegalArgumentException("[Node: " + node.getName() + "] depends on unknown node '"
                            + dependency.nodeName() + "'");
                }
                if (!seen.add(dependency.nodeName())) {
                    throw new IllegalArgumentException("[Node: " + node.getName() + "] declares dependency '"
                            + dependency.nodeName() + "' more than once");
                }
            }
        }
        List<String> cycle = findCycle(byName);
        if (!cycle.isEmpty()) {
            log.error("Dependency cycle detected: {}", String.join(" -> ", cycle));
            throw new DependencyCycleException(cycle);
        }
        DependencyGraph graph = new DependencyGraph(byName);
        log.info("Built dependency graph with {} nodes in {} layers: {}", byName.size(), graph.layers.size(), graph.layers);
        return graph;
    }

    public ServiceNode getNode(String name) {
        ServiceNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Unknown service node: " + name);
        }
        return node;
    }

    public Set<String> getNodeNames() {
        return nodes.keySet();
    }

    public Collection<ServiceNode> getNodes() {
        return nodes.values();
    }

    /**
     * Nodes that declare a dependency on the given node.
     */
    public Set<String> getDependents(String name) {
        return dependents.getOrDefault(name, Collections.emptySet());
    }

    /**
     * Nodes grouped so that every node's dependencies sit in earlier layers. Nodes in the same
     * layer are mutually independent.
     */
    public List<List<String>> getLayers() {
        return layers;
    }

    /**
     * Flattened topological order.
     */
    public List<String> getStartOrder() {
        List<String> order = new ArrayList<>();
        layers.forEach(order::addAll);
        return order;
    }

    /**
     * Every node reachable by following dependencies from the given node.
     */
    public Set<String> getTransitiveDependencies(String name) {
        Set<String> result = new LinkedHashSet<>();
        collectDependencies(name, result);
        return result;
    }

    private void collectDependencies(String name, Set<String> result) {
        for (Dependency dependency : getNode(name).getDependencies()) {
            if (result.add(dependency.nodeName())) {
                collectDependencies(dependency.nodeName(), result);
            }
        }
    }

    private static Map<String, Set<String>> buildDependents(Map<String, ServiceNode> nodes) {
        Map<String, Set<String>> result = new HashMap<>();
        for (ServiceNode node : nodes.values()) {
            for (Dependency dependency : node.getDependencies()) {
                result.computeIfAbsent(dependency.nodeName(), k -> new TreeSet<>()).add(node.getName());
            }
        }
        result.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return result;
    }

    private static List<List<String>> computeLayers(Map<String, ServiceNode> nodes) {
        Map<String, Integer> remaining = new TreeMap<>();
        for (ServiceNode node : nodes.values()) {
            remaining.put(node.getName(), node.getDependencies().size());
        }
        Map<String, Set<String>> dependents = buildDependents(nodes);
        List<List<String>> result = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<String> layer = new ArrayList<>();
            remaining.forEach((name, count) -> {
                if (count == 0) {
                    layer.add(name);
                }
            });
            for (String name : layer) {
                remaining.remove(name);
                for (String dependent : dependents.getOrDefault(name, Collections.emptySet())) {
                    remaining.computeIfPresent(dependent, (k, v) -> v - 1);
                }
            }
            result.add(Collections.unmodifiableList(layer));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Depth-first search with three colours. Returns the first cycle found as a closed path
     * ({@code a -> b -> c -> a}), or an empty list.
     */
    private static List<String> findCycle(Map<String, ServiceNode> nodes) {
        Map<String, Integer> colour = new HashMap<>();
        for (String start : nodes.keySet()) {
            if (colour.getOrDefault(start, 0) == 0) {
                List<String> path = new ArrayList<>();
                List<String> cycle = visit(start, nodes, colour, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private static List<String> visit(String name, Map<String, ServiceNode> nodes, Map<String, Integer> colour, List<String> path) {
        colour.put(name, 1);
        path.add(name);
        for (Dependency dependency : nodes.get(name).getDependencies()) {
            String next = dependency.nodeName();
            int state = colour.getOrDefault(next, 0);
            if (state == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (state == 0) {
                List<String> cycle = visit(next, nodes, colour, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        colour.put(name, 2);
        return List.of();
    }
}
