package io.stackcontroller.orchestration;

import io.stackcontroller.enums.NodeState;

/**
 * Notified after every state transition, on the thread that performed it.
 */
@FunctionalInterface
public interface NodeStateListener {

    void onTransition(String nodeName, NodeState from, NodeState to);
}
