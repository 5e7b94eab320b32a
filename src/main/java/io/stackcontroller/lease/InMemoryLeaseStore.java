package io.stackcontroller.lease;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lease store for a single controller process.
 */
@Slf4j
public class InMemoryLeaseStore implements LeaseStore {

    private final Clock clock;
    private final Map<String, Held> leases = new HashMap<>();

    public InMemoryLeaseStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLeaseStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized boolean tryAcquireLease(String key, String holder, Duration ttl) {
        Instant now = clock.instant();
        leases.values().removeIf(held -> !now.isBefore(held.expiresAt));
        Held current = live(key);
        if (current != null && !current.holder.equals(holder)) {
            return false;
        }
        leases.put(key, new Held(holder, clock.instant().plus(ttl)));
        if (current == null) {
            log.debug("Lease {} acquired by {}", key, holder);
        }
        return true;
    }

    @Override
    public synchronized boolean renewLease(String key, String holder, Duration ttl) {
        Held current = live(key);
        if (current == null || !current.holder.equals(holder)) {
            return false;
        }
        leases.put(key, new Held(holder, clock.instant().plus(ttl)));
        return true;
    }

    @Override
    public synchronized boolean releaseLease(String key, String holder) {
        Held current = live(key);
        if (current == null || !current.holder.equals(holder)) {
            return false;
        }
        leases.remove(key);
        log.debug("Lease {} released by {}", key, holder);
        return true;
    }

    @Override
    public synchronized Optional<String> getHolder(String key) {
        Held current = live(key);
        return current == null ? Optional.empty() : Optional.of(current.holder);
    }

    private Held live(String key) {
        Held current = leases.get(key);
        if (current != null && !clock.instant().isBefore(current.expiresAt)) {
            leases.remove(key);
            return null;
        }
        return current;
    }

    private record Held(String holder, Instant expiresAt) {
    }
}
