package io.stackcontroller.orchestration;

import io.stackcontroller.enums.NodeState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single owner of the current state of every service node.
 *
 * Mutation is package-private and only reachable through {@link ServiceOrchestrator}; the
 * router, status API and dependents read through {@link #getState(String)} or
 * {@link #snapshot()}.
 */
@Slf4j
public class NodeStateRegistry {

    private static final Map<NodeState, Set<NodeState>> ALLOWED = new EnumMap<>(NodeState.class);

    static {
        ALLOWED.put(NodeState.PENDING, EnumSet.of(NodeState.STARTING, NodeState.STOPPED));
        ALLOWED.put(NodeState.STARTING, EnumSet.of(NodeState.PROBING, NodeState.HEALTHY, NodeState.FAILED, NodeState.STOPPED));
        ALLOWED.put(NodeState.PROBING, EnumSet.of(NodeState.HEALTHY, NodeState.FAILED, NodeState.STOPPED));
        ALLOWED.put(NodeState.HEALTHY, EnumSet.of(NodeState.FAILED, NodeState.STOPPED));
        ALLOWED.put(NodeState.FAILED, EnumSet.of(NodeState.PENDING, NodeState.HEALTHY, NodeState.STOPPED));
        ALLOWED.put(NodeState.STOPPED, EnumSet.noneOf(NodeState.class));
    }

    private final Map<String, NodeStatus> states = new ConcurrentHashMap<>();
    private final List<NodeStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public NodeStateRegistry() {
        this(Clock.systemUTC());
    }

    public NodeStateRegistry(Clock clock) {
        this.clock = clock;
    }

    public void addListener(NodeStateListener listener) {
        listeners.add(listener);
    }

    public NodeState getState(String nodeName) {
        NodeStatus status = states.get(nodeName);
        return status != null ? status.state() : null;
    }

    public Optional<NodeStatus> getStatus(String nodeName) {
        return Optional.ofNullable(states.get(nodeName));
    }

    public boolean isHealthy(String nodeName) {
        return getState(nodeName) == NodeState.HEALTHY;
    }

    /**
     * Copy of every node's status, ordered by name.
     */
    public Map<String, NodeStatus> snapshot() {
        Map<String, NodeStatus> copy = new LinkedHashMap<>();
        states.keySet().stream().sorted().forEach(name -> copy.put(name, states.get(name)));
        return Collections.unmodifiableMap(copy);
    }

    void register(Collection<String> nodeNames) {
        Instant now = clock.instant();
        for (String name : nodeNames) {
            states.put(name, new NodeStatus(name, NodeState.PENDING, null, 0, false, now));
        }
    }

    /**
     * Move a node to a new state.
     *
     * @throws IllegalStateException if the transition is not part of the node state machine
     */
    synchronized void transition(String nodeName, NodeState to) {
        NodeStatus current = requireStatus(nodeName);
        NodeState from = current.state();
        if (from == to) {
            return;
        }
        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException("[Node: " + nodeName + "] illegal transition " + from + " -> " + to);
        }
        int restarts = current.restarts() + (from == NodeState.FAILED && to == NodeState.PENDING ? 1 : 0);
        boolean everHealthy = current.everHealthy() || to == NodeState.HEALTHY;
        states.put(nodeName, new NodeStatus(nodeName, to, current.lastProbeError(), restarts, everHealthy, clock.instant()));
        log.info("[Node: {}] {} -> {}", nodeName, from, to);
        for (NodeStateListener listener : listeners) {
            try {
                listener.onTransition(nodeName, from, to);
            } catch (Exception e) {
                log.warn("[Node: {}] State listener failed: {}", nodeName, e.getMessage());
            }
        }
    }

    synchronized void recordProbeError(String nodeName, String error) {
        NodeStatus current = requireStatus(nodeName);
        states.put(nodeName, new NodeStatus(nodeName, current.state(), error, current.restarts(),
                current.everHealthy(), current.since()));
    }

    private NodeStatus requireStatus(String nodeName) {
        NodeStatus status = states.get(nodeName);
        if (status == null) {
            throw new IllegalArgumentException("Unknown service node: " + nodeName);
        }
        return status;
    }
}
