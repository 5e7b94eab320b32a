package io.stackcontroller.worker.handlers;

import io.stackcontroller.models.Task;
import io.stackcontroller.worker.TaskContext;
import io.stackcontroller.worker.TaskHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Runs the delegate only when no other run holds the lock; an overlapping run is acknowledged
 * without doing anything.
 */
@Slf4j
public class SingleFlightTaskHandler implements TaskHandler {

    private final String lockName;
    private final Duration ttl;
    private final TaskHandler delegate;

    public SingleFlightTaskHandler(String lockName, Duration ttl, TaskHandler delegate) {
        this.lockName = lockName;
        this.ttl = ttl;
        this.delegate = delegate;
    }

    @Override
    public void handle(Task task, TaskContext context) throws Exception {
        String key = context.getTierId() + "/" + lockName;
        boolean ran = context.getLock().runExclusively(key, ttl, () -> {
            delegate.handle(task, context);
            return Boolean.TRUE;
        }).isPresent();
        if (!ran) {
            log.info("[Tier: {}] {} ({}) skipped, {} is busy", context.getTierId(), task.getName(), task.getId(), key);
        }
    }
}
