package io.stackcontroller.launcher;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A started service node.
 */
public interface ServiceHandle {

    /**
     * Completes with the exit code once the underlying process ends. Never completes for
     * nodes managed outside this controller.
     */
    CompletableFuture<Integer> onExit();

    boolean isAlive();

    /**
     * Ask the node to stop (SIGTERM for processes). Does not wait.
     */
    void requestStop();

    /**
     * Terminate immediately.
     */
    void forceStop();

    /**
     * Request a stop, wait up to {@code grace}, then force-terminate.
     *
     * @return true if the node stopped within the grace period
     */
    default boolean stop(Duration grace) {
        requestStop();
        try {
            onExit().get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            // still running, forced below
        }
        forceStop();
        return false;
    }
}
