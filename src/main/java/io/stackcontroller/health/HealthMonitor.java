package io.stackcontroller.health;

import io.stackcontroller.models.HealthCheckSpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a node's probe and keeps the consecutive success and failure counters that turn single
 * probe results into a verdict.
 */
@Slf4j
public class HealthMonitor {

    /**
     * Outcome of the counters after a probe.
     */
    public enum Verdict {
        /** Consecutive successes reached the success threshold. */
        HEALTHY,
        /** Consecutive failures reached the retry budget. */
        UNHEALTHY,
        /** Neither threshold reached yet. */
        UNDECIDED
    }

    private final String nodeName;
    private final HealthCheckSpec spec;
    private final HealthProbe probe;

    private int consecutiveSuccesses;
    private int consecutiveFailures;
    private String lastError;

    public HealthMonitor(String nodeName, HealthCheckSpec spec, HealthProbe probe) {
        this.nodeName = nodeName;
        this.spec = spec;
        this.probe = probe;
    }

    /**
     * Run one probe and fold the result into the counters.
     */
    public synchronized Verdict probeOnce() {
        try {
            probe.check(spec.getTimeout());
            return recordSuccess();
        } catch (ProbeException e) {
            return recordFailure(e.getMessage());
        } catch (RuntimeException e) {
            return recordFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    synchronized Verdict recordSuccess() {
        consecutiveFailures = 0;
        consecutiveSuccesses++;
        return consecutiveSuccesses >= spec.getSuccessThreshold() ? Verdict.HEALTHY : Verdict.UNDECIDED;
    }

    synchronized Verdict recordFailure(String error) {
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        lastError = error;
        if (consecutiveFailures >= spec.getRetries()) {
            return Verdict.UNHEALTHY;
        }
        log.warn("[Node: {}] Probe failed ({}/{}): {}", nodeName, consecutiveFailures, spec.getRetries(), error);
        return Verdict.UNDECIDED;
    }

    /**
     * Clear the counters, used when the node is restarted.
     */
    public synchronized void reset() {
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;
    }

    public synchronized int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized String getLastError() {
        return lastError;
    }
}
