package io.stackcontroller.orchestration;

import io.stackcontroller.health.HealthProbe;
import io.stackcontroller.health.HealthProbeFactory;
import io.stackcontroller.health.ProbeException;
import io.stackcontroller.models.HealthCheckSpec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes keyed by the health check target; a test flips each target between passing and
 * failing. Targets that were never set fail.
 */
class ScriptedProbeFactory extends HealthProbeFactory {

    private final Map<String, Boolean> passing = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    @Override
    public HealthProbe create(HealthCheckSpec spec) {
        String target = spec.getTarget();
        return timeout -> {
            calls.computeIfAbsent(target, k -> new AtomicInteger()).incrementAndGet();
            if (!passing.getOrDefault(target, false)) {
                throw new ProbeException("connection refused: " + target);
            }
        };
    }

    void setPassing(String target, boolean value) {
        passing.put(target, value);
    }

    int calls(String target) {
        AtomicInteger count = calls.get(target);
        return count != null ? count.get() : 0;
    }
}
