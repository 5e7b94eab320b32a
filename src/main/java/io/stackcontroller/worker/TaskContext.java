package io.stackcontroller.worker;

import io.stackcontroller.lease.SingleFlightLock;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What a handler may touch besides its task: the tier it runs in, a publisher for chained
 * tasks on the same broker endpoint, and a lock for work that must not overlap.
 */
@Getter
@AllArgsConstructor
public class TaskContext {

    private final String tierId;

    private final String brokerEndpointId;

    private final TaskPublisher publisher;

    private final SingleFlightLock lock;
}
