package io.stackcontroller.orchestration;

import io.stackcontroller.enums.NodeState;

import java.time.Instant;

/**
 * Read-only view of one node's state as held by the registry.
 */
public record NodeStatus(
        String name,
        NodeState state,
        String lastProbeError,
        int restarts,
        boolean everHealthy,
        Instant since) {
}
