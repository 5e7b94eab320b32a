package io.stackcontroller.enums;

/**
 * What a worker did with a claimed task.
 */
public enum TaskOutcome {
    ACKNOWLEDGED,
    RETRIED,
    DEAD_LETTERED,
    ABANDONED
}
