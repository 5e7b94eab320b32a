package io.stackcontroller.lease;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Runs a piece of work only if nobody else is running it under the same key. The lease is
 * taken with a fresh holder token and released by compare-and-delete on that token, so a
 * holder whose lease already expired never deletes its successor's lease.
 */
@Slf4j
public class SingleFlightLock {

    private final LeaseStore leaseStore;

    public SingleFlightLock(LeaseStore leaseStore) {
        this.leaseStore = leaseStore;
    }

    /**
     * @return the work's result, or empty when the lease is held elsewhere
     */
    public <T> Optional<T> runExclusively(String key, Duration ttl, Callable<T> work) throws Exception {
        String token = UUID.randomUUID().toString();
        if (!leaseStore.tryAcquireLease(key, token, ttl)) {
            log.info("Lock {} is held elsewhere, skipping", key);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(work.call());
        } finally {
            try {
                if (!leaseStore.releaseLease(key, token)) {
                    log.warn("Lock {} expired before the work finished", key);
                }
            } catch (LeaseException e) {
                log.error("Failed to release lock {}: {}", key, e.getMessage(), e);
            }
        }
    }

    public boolean isBusy(String key) throws LeaseException {
        return leaseStore.getHolder(key).isPresent();
    }
}
