package com.flagship.recycling_ledger.deposit.guard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process store for local runs and tests. Not shared across instances.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, now.plus(ttl));
        });
        return created.get();
    }

    @Override
    public long incrementBy(String key, long delta, Duration ttl) {
        Entry updated = entries.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing == null || existing.isExpired(now)) {
                return new Entry(String.valueOf(delta), now.plus(ttl));
            }
            long next = Long.parseLong(existing.value) + delta;
            return new Entry(String.valueOf(next), existing.expiresAt);
        });
        return Long.parseLong(updated.value);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public String backend() {
        return "in-memory";
    }

    @Override
    public void ping() {
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
