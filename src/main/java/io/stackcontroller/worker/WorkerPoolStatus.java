package io.stackcontroller.worker;

import java.util.Map;

/**
 * Liveness view of a worker pool.
 */
public record WorkerPoolStatus(String tierId,
                               String brokerEndpointId,
                               boolean running,
                               int inFlight,
                               Map<String, Long> claimedPerQueue,
                               Map<String, Long> outcomes) {
}
