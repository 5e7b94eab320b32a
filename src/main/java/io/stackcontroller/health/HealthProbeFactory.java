package io.stackcontroller.health;

import io.stackcontroller.models.HealthCheckSpec;

/**
 * Creates the probe a {@link io.stackcontroller.models.HealthCheckSpec} describes.
 */
public class HealthProbeFactory {

    public HealthProbe create(HealthCheckSpec spec) {
        switch (spec.getType()) {
            case COMMAND:
                return new CommandHealthProbe(spec.getCommand());
            case HTTP:
                return new HttpHealthProbe(spec.getTarget());
            case TCP:
                return new TcpHealthProbe(spec.getTarget());
            default:
                throw new IllegalArgumentException("Unsupported probe type: " + spec.getType());
        }
    }
}
