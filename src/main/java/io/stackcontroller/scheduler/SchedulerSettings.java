package io.stackcontroller.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

import static io.stackcontroller.config.Constants.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerSettings {

    /**
     * TTL of the leader lease; renewed on every tick.
     */
    @Builder.Default
    private Duration leaseTtl = Duration.ofSeconds(DEFAULT_SCHEDULER_LEASE_TTL_SECONDS);

    @Builder.Default
    private Duration tickInterval = Duration.ofMillis(DEFAULT_SCHEDULER_TICK_MILLIS);

    /**
     * How long a fire-time claim is remembered. Must outlast any leader handover.
     */
    @Builder.Default
    private Duration fireClaimTtl = Duration.ofSeconds(DEFAULT_FIRE_CLAIM_TTL_SECONDS);
}
