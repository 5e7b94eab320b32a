package io.stackcontroller.health;

import java.time.Duration;

/**
 * One round-trip health check against a service endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Returns normally when the endpoint is healthy.
     *
     * @param timeout upper bound for the round-trip
     * @throws ProbeException with a human-readable reason when it is not
     */
    void check(Duration timeout) throws ProbeException;
}
