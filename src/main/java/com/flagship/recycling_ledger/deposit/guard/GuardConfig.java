package com.flagship.recycling_ledger.deposit.guard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the fraud-check policy and the shared store.
 *
 * deposit.guard.store selects the backend: "redis" (default) or "in-memory".
 */
@Configuration
@Slf4j
public class GuardConfig {

    @Bean
    public GuardPolicy guardPolicy(
            @Value("${deposit.guard.max-weight-kg:50}") BigDecimal maxWeightKg,
            @Value("${deposit.guard.daily-deposit-limit:50}") int dailyDepositLimit,
            @Value("${deposit.guard.velocity-limit:10}") int velocityLimit,
            @Value("${deposit.guard.velocity-window:5m}") Duration velocityWindow,
            @Value("${deposit.guard.duplicate-window:60s}") Duration duplicateWindow,
            @Value("${deposit.guard.machine-daily-capacity-kg:500}") BigDecimal machineDailyCapacityKg,
            @Value("${deposit.guard.zone:UTC}") String zone) {

        GuardPolicy policy = GuardPolicy.builder()
            .maxWeightKg(maxWeightKg)
            .dailyDepositLimit(dailyDepositLimit)
            .velocityLimit(velocityLimit)
            .velocityWindow(velocityWindow)
            .duplicateWindow(duplicateWindow)
            .machineDailyCapacityKg(machineDailyCapacityKg)
            .zone(ZoneId.of(zone))
            .build();
        log.info("Deposit guard policy: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnProperty(name = "deposit.guard.store", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "deposit.guard.store", havingValue = "in-memory")
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        log.warn("Deposit guard uses an in-memory store; counters are not shared between instances");
        return new InMemoryKeyValueStore(clock);
    }
}
