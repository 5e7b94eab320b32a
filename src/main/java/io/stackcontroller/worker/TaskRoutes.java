package io.stackcontroller.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task name to queue routing for one tier. Unrouted names go to the default queue.
 */
public class TaskRoutes {

    private final String defaultQueue;
    private final Map<String, String> routes;

    public TaskRoutes(String defaultQueue, Map<String, String> routes) {
        if (defaultQueue == null || defaultQueue.isBlank()) {
            throw new IllegalArgumentException("Default queue cannot be null or empty");
        }
        this.defaultQueue = defaultQueue;
        this.routes = routes != null ? new LinkedHashMap<>(routes) : new LinkedHashMap<>();
    }

    public String queueFor(String taskName) {
        return routes.getOrDefault(taskName, defaultQueue);
    }

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public Map<String, String> getRoutes() {
        return Collections.unmodifiableMap(routes);
    }
}
