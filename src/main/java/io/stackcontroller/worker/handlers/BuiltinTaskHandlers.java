package io.stackcontroller.worker.handlers;

import io.stackcontroller.worker.TaskHandler;
import io.stackcontroller.worker.TaskHandlerRegistry;

import java.time.Duration;

/**
 * Handlers registered for the periodic task names of the two tiers.
 */
public final class BuiltinTaskHandlers {

    public static final String UPDATE_CAR_BIDS = "tasks.task.update_car_bids";
    public static final String UPDATE_FEES = "tasks.task.update_fees";
    public static final String PARSE_AND_UPDATE_CAR = "tasks.task.parse_and_update_car";
    public static final String FETCH_API_DATA = "tasks.tasks.fetch_api_data";

    static final String KICKOFF_LOCK = "kickoff";
    static final Duration KICKOFF_LOCK_TTL = Duration.ofHours(2);

    private BuiltinTaskHandlers() {
        // Utility class
    }

    /**
     * Register a handler for every known task name the registry does not handle yet.
     */
    public static TaskHandlerRegistry registerDefaults(TaskHandlerRegistry registry) {
        LoggingTaskHandler logging = new LoggingTaskHandler();
        registerIfAbsent(registry, UPDATE_CAR_BIDS, new SingleFlightTaskHandler(KICKOFF_LOCK, KICKOFF_LOCK_TTL, logging));
        registerIfAbsent(registry, UPDATE_FEES, logging);
        registerIfAbsent(registry, PARSE_AND_UPDATE_CAR, logging);
        registerIfAbsent(registry, FETCH_API_DATA, logging);
        return registry;
    }

    private static void registerIfAbsent(TaskHandlerRegistry registry, String taskName, TaskHandler handler) {
        if (registry.find(taskName).isEmpty()) {
            registry.register(taskName, handler);
        }
    }
}
