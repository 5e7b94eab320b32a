package io.stackcontroller.worker;

import io.stackcontroller.models.Task;

/**
 * Business logic for one task name. Throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface TaskHandler {

    void handle(Task task, TaskContext context) throws Exception;
}
