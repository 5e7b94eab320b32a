package io.stackcontroller.worker;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlers by task name for one tier.
 */
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public TaskHandlerRegistry register(String taskName, TaskHandler handler) {
        if (handlers.putIfAbsent(taskName, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for task: " + taskName);
        }
        return this;
    }

    public Optional<TaskHandler> find(String taskName) {
        return Optional.ofNullable(handlers.get(taskName));
    }

    public Set<String> getTaskNames() {
        return Set.copyOf(handlers.keySet());
    }
}
