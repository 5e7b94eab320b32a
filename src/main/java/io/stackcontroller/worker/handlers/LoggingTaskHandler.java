package io.stackcontroller.worker.handlers;

import io.stackcontroller.models.Task;
import io.stackcontroller.worker.TaskContext;
import io.stackcontroller.worker.TaskHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * Acknowledges a task after logging it. Stands in for application handlers that are not
 * deployed in this process so that scheduled tasks drain instead of piling up.
 */
@Slf4j
public class LoggingTaskHandler implements TaskHandler {

    @Override
    public void handle(Task task, TaskContext context) {
        log.info("[Tier: {}] {} ({}) attempt {} payload {}", context.getTierId(), task.getName(), task.getId(),
                task.getAttemptCount() + 1, task.getPayload());
    }
}
