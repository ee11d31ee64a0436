package com.flagship.recycling_ledger.deposit.guard;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store. Counters live across all application instances.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public long incrementBy(String key, long delta, Duration ttl) {
        // SET NX EX creates the counter with its expiry, so no key ever lives without one
        redisTemplate.opsForValue().setIfAbsent(key, "0", ttl);
        Long value = redisTemplate.opsForValue().increment(key, delta);
        if (value == null) {
            throw new IllegalStateException("Redis INCRBY returned no value for key " + key);
        }
        return value;
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public String backend() {
        return "redis";
    }

    @Override
    public void ping() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (!"PONG".equals(reply)) {
            throw new IllegalStateException("Unexpected Redis PING reply: " + reply);
        }
    }
}
