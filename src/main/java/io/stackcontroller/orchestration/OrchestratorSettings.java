package io.stackcontroller.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Timing knobs for {@link ServiceOrchestrator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorSettings {

    /**
     * Time allowed for every node to become ready before the plan is declared unsatisfiable.
     */
    @Builder.Default
    private Duration startupBudget = Duration.ofMinutes(10);

    @Builder.Default
    private Duration shutdownGrace = Duration.ofSeconds(10);

    @Builder.Default
    private Duration restartInitialBackoff = Duration.ofSeconds(1);

    @Builder.Default
    private Duration restartMaxBackoff = Duration.ofSeconds(60);

    /**
     * Threads shared by launches and probes.
     */
    @Builder.Default
    private int ioThreads = 8;

    /**
     * {@code min(initial * 2^(restart-1), max)} for the given 1-based restart number.
     */
    public Duration restartBackoff(int restart) {
        if (restart < 1) {
            return Duration.ZERO;
        }
        long initial = restartInitialBackoff.toMillis();
        long max = restartMaxBackoff.toMillis();
        int shift = Math.min(restart - 1, 30);
        long delay = initial << shift;
        if (delay < 0 || delay > max) {
            delay = max;
        }
        return Duration.ofMillis(delay);
    }
}
