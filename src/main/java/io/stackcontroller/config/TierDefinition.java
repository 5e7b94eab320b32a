package io.stackcontroller.config;

import io.stackcontroller.models.ScheduledTask;
import io.stackcontroller.scheduler.SchedulerSettings;
import io.stackcontroller.worker.WorkerPoolSettings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to assemble one application tier: its own broker endpoint, queues,
 * routing table, worker pool and beat schedule.
 */
@Getter
@Builder
@ToString
public class TierDefinition {

    private final String id;

    private final String brokerId;

    /**
     * {@code memory} or {@code etcd}.
     */
    private final String brokerType;

    private final List<String> brokerEndpoints;

    private final String brokerNamespace;

    private final String defaultQueue;

    private final List<String> queues;

    private final Map<String, String> routes;

    private final WorkerPoolSettings workerSettings;

    private final int maxAttempts;

    private final boolean schedulerEnabled;

    private final SchedulerSettings schedulerSettings;

    private final List<ScheduledTask> schedule;
}
