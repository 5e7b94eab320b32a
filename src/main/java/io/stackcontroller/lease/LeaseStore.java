package io.stackcontroller.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded exclusive claims on named keys. A lease that is not renewed before its TTL
 * elapses is gone, and another holder may take it.
 */
public interface LeaseStore {

    /**
     * Acquire {@code key} for {@code holder}, or extend it when {@code holder} already owns it.
     *
     * @return true when {@code holder} owns the lease afterwards
     */
    boolean tryAcquireLease(String key, String holder, Duration ttl) throws LeaseException;

    /**
     * Extend a lease held by {@code holder}.
     *
     * @return false when the lease expired or belongs to someone else
     */
    boolean renewLease(String key, String holder, Duration ttl) throws LeaseException;

    /**
     * Delete the lease only if {@code holder} still owns it.
     */
    boolean releaseLease(String key, String holder) throws LeaseException;

    Optional<String> getHolder(String key) throws LeaseException;
}
