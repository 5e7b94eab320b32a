package io.stackcontroller.models;

import io.stackcontroller.enums.ProbeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * How and how often a node's health is checked.
 *
 * Defaults follow the usual container health check defaults: 30s interval and timeout,
 * 3 retries, no start period, one success to become healthy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckSpec {

    @Builder.Default
    private ProbeType type = ProbeType.COMMAND;

    /**
     * Command line for {@link ProbeType#COMMAND} probes.
     */
    private List<String> command;

    /**
     * URL for {@link ProbeType#HTTP} probes, {@code host:port} for {@link ProbeType#TCP}.
     */
    private String target;

    @Builder.Default
    private Duration interval = Duration.ofSeconds(30);

    @Builder.Default
    private Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    private int retries = 3;

    @Builder.Default
    private Duration startPeriod = Duration.ZERO;

    @Builder.Default
    private int successThreshold = 1;

    public void validate(String nodeName) {
        if (retries < 1) {
            throw new IllegalArgumentException("[Node: " + nodeName + "] health check retries must be >= 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("[Node: " + nodeName + "] health check success_threshold must be >= 1");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("[Node: " + nodeName + "] health check interval must be positive");
        }
        if (type == ProbeType.COMMAND && (command == null || command.isEmpty())) {
            throw new IllegalArgumentException("[Node: " + nodeName + "] command health check needs a command");
        }
        if (type != ProbeType.COMMAND && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("[Node: " + nodeName + "] " + type + " health check needs a target");
        }
    }
}
