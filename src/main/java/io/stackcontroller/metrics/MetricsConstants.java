package io.stackcontroller.metrics;

/**
 * Constants for metric names and tags.
 */
public class MetricsConstants {
    public final static String TASKS_CLAIMED_METRIC_NAME = "stack_tasks_claimed";
    public final static String TASKS_COMPLETED_METRIC_NAME = "stack_tasks_completed";
    public final static String TASK_DURATION_METRIC_NAME = "stack_task_duration";
    public final static String SCHEDULE_FIRES_METRIC_NAME = "stack_schedule_fires";
    public final static String SCHEDULER_LEADER_METRIC_NAME = "stack_scheduler_leader";
    public final static String PROXY_REQUESTS_METRIC_NAME = "stack_proxy_requests";
    public final static String NODE_STATE_METRIC_NAME = "stack_node_healthy";

    public final static String TIER_TAG = "tier";
    public final static String BROKER_TAG = "broker";
    public final static String QUEUE_TAG = "queue";
    public final static String OUTCOME_TAG = "outcome";
    public final static String ENTRY_TAG = "entry";
    public final static String ROUTE_TAG = "route";
    public final static String STATUS_TAG = "status";
    public final static String NODE_TAG = "node";

    private MetricsConstants() {}
}
