package com.flagship.recycling_ledger.deposit;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Linear reward formula: points = round(weight * rate, 2), half-up.
 */
@Component
public class RewardCalculator {

    public static final int POINTS_SCALE = 2;

    public BigDecimal pointsFor(BigDecimal weightKg, BigDecimal pointsPerKg) {
        if (weightKg == null || pointsPerKg == null) {
            throw new IllegalArgumentException("Weight and rate are required");
        }
        return weightKg.multiply(pointsPerKg).setScale(POINTS_SCALE, RoundingMode.HALF_UP);
    }
}
