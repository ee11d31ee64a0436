package com.flagship.recycling_ledger.deposit.guard;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable fraud-check limits, read once at startup.
 *
 * Boundaries:
 * - weight: must be > 0 and at most {@code maxWeightKg}
 * - daily: rejected when the user already has {@code dailyDepositLimit} deposits today
 * - velocity: rejected when more than {@code velocityLimit} deposits fall inside the window
 * - capacity: rejected when the machine's day total would exceed the ceiling
 */
@Value
@Builder(toBuilder = true)
public class GuardPolicy {
    BigDecimal maxWeightKg;
    int dailyDepositLimit;
    int velocityLimit;
    Duration velocityWindow;
    Duration duplicateWindow;
    BigDecimal machineDailyCapacityKg;
    ZoneId zone;

    public static GuardPolicy defaults() {
        return GuardPolicy.builder()
            .maxWeightKg(new BigDecimal("50"))
            .dailyDepositLimit(50)
            .velocityLimit(10)
            .velocityWindow(Duration.ofMinutes(5))
            .duplicateWindow(Duration.ofSeconds(60))
            .machineDailyCapacityKg(new BigDecimal("500"))
            .zone(ZoneId.of("UTC"))
            .build();
    }
}
