package com.flagship.recycling_ledger.totals;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's running totals, derived from the deposit ledger.
 *
 * Invariant: totalPoints == sum(pointsEarned), totalWeightKg == sum(weightKg)
 * and depositCount == count over that user's ledger entries.
 *
 * Points always carry scale 2 and weight scale 3, whichever path produced them,
 * so values from the incremental path and from a rebuild compare equal.
 */
@Value
public class UserTotals {
    public static final int POINTS_SCALE = 2;
    public static final int WEIGHT_SCALE = 3;

    UUID userId;
    BigDecimal totalPoints;
    BigDecimal totalWeightKg;
    long depositCount;
    Instant updatedAt;
    Instant rebuiltAt;

    public static UserTotals of(UUID userId, BigDecimal totalPoints, BigDecimal totalWeightKg,
                                long depositCount, Instant updatedAt, Instant rebuiltAt) {
        return new UserTotals(
            userId,
            totalPoints.setScale(POINTS_SCALE, RoundingMode.UNNECESSARY),
            totalWeightKg.setScale(WEIGHT_SCALE, RoundingMode.UNNECESSARY),
            depositCount,
            updatedAt,
            rebuiltAt
        );
    }

    /**
     * Totals of a user with no ledger entries.
     */
    public static UserTotals empty(UUID userId) {
        return of(userId, BigDecimal.ZERO, BigDecimal.ZERO, 0, null, null);
    }

    /**
     * Compares points, weight and count; timestamps are ignored.
     */
    public boolean sameTotalsAs(UserTotals other) {
        return totalPoints.compareTo(other.totalPoints) == 0
            && totalWeightKg.compareTo(other.totalWeightKg) == 0
            && depositCount == other.depositCount;
    }
}
