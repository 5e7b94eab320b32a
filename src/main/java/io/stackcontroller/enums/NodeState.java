package io.stackcontroller.enums;

/**
 * Lifecycle state of a service node, owned by the orchestrator.
 *
 * <ul>
 *   <li><strong>PENDING</strong> - waiting for its dependencies to satisfy their conditions</li>
 *   <li><strong>STARTING</strong> - the start command has been issued</li>
 *   <li><strong>PROBING</strong> - started, health check running but not yet passed</li>
 *   <li><strong>HEALTHY</strong> - health check passed (or node has no health check)</li>
 *   <li><strong>FAILED</strong> - health check exhausted its retries</li>
 *   <li><strong>STOPPED</strong> - terminal, either shut down or given up on</li>
 * </ul>
 */
public enum NodeState {
    PENDING,
    STARTING,
    PROBING,
    HEALTHY,
    FAILED,
    STOPPED;

    /**
     * Whether the node's process has been started and not torn down.
     */
    public boolean hasStarted() {
        return this == STARTING || this == PROBING || this == HEALTHY || this == FAILED;
    }
}
