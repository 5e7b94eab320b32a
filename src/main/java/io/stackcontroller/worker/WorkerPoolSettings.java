package io.stackcontroller.worker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.stackcontroller.config.Constants.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerPoolSettings {

    /**
     * Maximum number of tasks executing at once per bound queue.
     */
    @Builder.Default
    private int concurrency = DEFAULT_WORKER_CONCURRENCY;

    /**
     * Per-queue overrides of {@link #concurrency}.
     */
    @Builder.Default
    private Map<String, Integer> queueConcurrency = new LinkedHashMap<>();

    /**
     * How long a claimed task stays hidden before the broker redelivers it.
     */
    @Builder.Default
    private Duration visibilityTimeout = Duration.ofSeconds(DEFAULT_VISIBILITY_TIMEOUT_SECONDS);

    /**
     * Pause after a sweep over every bound queue found nothing.
     */
    @Builder.Default
    private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MILLIS);

    @Builder.Default
    private Duration shutdownGrace = Duration.ofSeconds(DEFAULT_SHUTDOWN_GRACE_SECONDS);

    public int concurrencyFor(String queueName) {
        Integer limit = queueConcurrency != null ? queueConcurrency.get(queueName) : null;
        return limit != null ? limit : concurrency;
    }
}
