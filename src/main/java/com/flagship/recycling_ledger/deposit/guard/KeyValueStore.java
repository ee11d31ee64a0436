package com.flagship.recycling_ledger.deposit.guard;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared, expiring key-value store used for cross-instance fraud counters.
 *
 * Implementations must make {@link #setIfAbsent} and {@link #incrementBy} atomic
 * with respect to concurrent callers on every application instance.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Stores the value only if the key does not exist yet.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Atomically adds {@code delta} to the numeric value at {@code key}, creating it
     * at zero first. The TTL is applied when the key is created.
     *
     * @return the value after the increment
     */
    long incrementBy(String key, long delta, Duration ttl);

    void delete(String key);

    /**
     * Short backend name, reported by the health endpoint.
     */
    String backend();

    /**
     * Round trip to the backend.
     *
     * @throws RuntimeException if the backend cannot be reached
     */
    void ping();
}
