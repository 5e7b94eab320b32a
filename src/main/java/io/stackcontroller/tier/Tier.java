package io.stackcontroller.tier;

import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.scheduler.PeriodicScheduler;
import io.stackcontroller.worker.TaskPublisher;
import io.stackcontroller.worker.WorkerPool;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * One application tier's task machinery. Everything in here talks to the tier's own broker
 * endpoint and nothing else.
 */
@Slf4j
@Getter
@Builder
public class Tier {

    private final String id;

    private final BrokerEndpoint brokerEndpoint;

    private final TaskPublisher publisher;

    private final WorkerPool workerPool;

    /**
     * Null when the tier has no beat.
     */
    private final PeriodicScheduler scheduler;

    /**
     * Nodes that must be healthy before workers and beat start.
     */
    private final List<String> requirements;

    private volatile boolean started;

    synchronized void start() {
        if (started) {
            return;
        }
        log.info("[Tier: {}] Requirements {} are healthy, starting workers{}", id, requirements,
                scheduler != null ? " and scheduler" : "");
        workerPool.start();
        if (scheduler != null) {
            scheduler.start();
        }
        started = true;
    }

    synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("[Tier: {}] Stopping", id);
        if (scheduler != null) {
            scheduler.stop();
        }
        workerPool.stop();
        started = false;
    }
}
