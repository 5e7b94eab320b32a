package io.stackcontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_PROFILE = "dev";
    public static final String DEFAULT_QUEUE = "default";
    public static final long DEFAULT_STARTUP_BUDGET_SECONDS = 600L;
    public static final long DEFAULT_SHUTDOWN_GRACE_SECONDS = 10L;
    public static final long DEFAULT_RESTART_INITIAL_BACKOFF_MILLIS = 1000L;
    public static final long DEFAULT_RESTART_MAX_BACKOFF_MILLIS = 60_000L;
    public static final int DEFAULT_WORKER_CONCURRENCY = 4;
    public static final long DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 300L;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 200L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_SCHEDULER_LEASE_TTL_SECONDS = 30L;
    public static final long DEFAULT_SCHEDULER_TICK_MILLIS = 1000L;
    public static final long DEFAULT_FIRE_CLAIM_TTL_SECONDS = 600L;
    public static final long DEFAULT_PROXY_CONNECT_TIMEOUT_SECONDS = 10L;
    public static final long DEFAULT_PROXY_SEND_TIMEOUT_SECONDS = 60L;
    public static final long DEFAULT_PROXY_READ_TIMEOUT_SECONDS = 300L;

    // Backend types
    public static final String BACKEND_MEMORY = "memory";
    public static final String BACKEND_ETCD = "etcd";

    // Environment variables
    public static final String ENV_PROFILE = "STACK_PROFILE";
    public static final String ENV_CONFIG_FILE = "STACK_CONFIG_FILE";
    public static final String ENV_INSTANCE_ID = "STACK_INSTANCE_ID";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_QUEUES = "queues";
    public static final String PATH_READY = "ready";
    public static final String PATH_IN_FLIGHT = "in-flight";
    public static final String PATH_DEAD_LETTERS = "dead-letters";
    public static final String PATH_LEASES = "leases";

    // Lease keys
    public static final String LEASE_SCHEDULER_LEADER = "beat-leader";
    public static final String LEASE_SCHEDULER_FIRED = "beat-fired";

    // Payload keys added by the scheduler
    public static final String PAYLOAD_SCHEDULE_ENTRY = "schedule_entry";
    public static final String PAYLOAD_SCHEDULED_FOR = "scheduled_for";

    // Process exit codes
    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILURE = 1;
    public static final int EXIT_UNSATISFIABLE_DEPENDENCY = 3;
    public static final int EXIT_DEPENDENCY_CYCLE = 4;
}
