package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dashboard view of one user's recycling activity.
 */
@Value
public class UserSummary {
    UserTotals totals;
    PeriodStats last30Days;
    List<MaterialBreakdown> materialBreakdown;
    String favoriteMaterial;
    List<Deposit> recentDeposits;
    long rank;

    @Value
    public static class PeriodStats {
        BigDecimal points;
        BigDecimal weightKg;
        long depositCount;
    }

    /**
     * Per-material totals, as recorded in the ledger under the material's name.
     */
    @Value
    public static class MaterialBreakdown {
        String materialName;
        BigDecimal weightKg;
        BigDecimal points;
        long depositCount;
    }
}
