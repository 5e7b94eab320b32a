package io.stackcontroller.worker;

import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.models.Task;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;

/**
 * Producer side of one tier's broker endpoint, used by API handlers, the scheduler and
 * chaining handlers. Publishing only touches the broker, so a handler that chains never
 * waits on the claim loop.
 */
@Slf4j
public class TaskPublisher {

    private final BrokerEndpoint endpoint;
    private final TaskRoutes routes;
    private final int defaultMaxAttempts;
    private final Clock clock;

    public TaskPublisher(BrokerEndpoint endpoint, TaskRoutes routes, int defaultMaxAttempts, Clock clock) {
        this.endpoint = endpoint;
        this.routes = routes;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.clock = clock;
    }

    public Task publish(String taskName, Map<String, Object> payload) throws BrokerException {
        return publish(Task.create(taskName, routes.queueFor(taskName), payload, defaultMaxAttempts));
    }

    /**
     * Enqueue a prepared task. A task without a queue is routed by its name.
     */
    public Task publish(Task task) throws BrokerException {
        if (task.getQueueName() == null || task.getQueueName().isBlank()) {
            task.setQueueName(routes.queueFor(task.getName()));
        }
        if (task.getEnqueuedAt() == null) {
            task.setEnqueuedAt(clock.instant());
        }
        endpoint.enqueue(task);
        log.debug("[Broker: {}] Published {} ({}) to {}", endpoint.getId(), task.getName(), task.getId(), task.getQueueName());
        return task;
    }

    public String getBrokerEndpointId() {
        return endpoint.getId();
    }

    public TaskRoutes getRoutes() {
        return routes;
    }
}
