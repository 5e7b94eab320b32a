package io.stackcontroller.orchestration;

import io.stackcontroller.enums.NodeState;
import io.stackcontroller.metrics.MetricsProvider;

import java.util.Map;

import static io.stackcontroller.metrics.MetricsConstants.*;

/**
 * Publishes one gauge per node: 1 while the node is healthy, 0 otherwise.
 */
public class NodeStateMetrics implements NodeStateListener {

    private final MetricsProvider metricsProvider;

    public NodeStateMetrics(MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;
    }

    @Override
    public void onTransition(String nodeName, NodeState from, NodeState to) {
        metricsProvider.gauge(NODE_STATE_METRIC_NAME, Map.of(NODE_TAG, nodeName)).set(to == NodeState.HEALTHY ? 1 : 0);
    }
}
