package com.flagship.recycling_ledger.totals;

import lombok.Getter;

import java.util.UUID;

/**
 * Stored totals disagree with a recomputation from the ledger.
 *
 * This is a bug signal raised by the consistency audit, never a normal
 * caller-facing outcome.
 */
@Getter
public class AggregateInconsistencyException extends RuntimeException {

    private final UUID userId;
    private final UserTotals stored;
    private final UserTotals expected;

    public AggregateInconsistencyException(UUID userId, UserTotals stored, UserTotals expected) {
        super(String.format(
            "Totals of user %s drifted from the ledger: stored points=%s weight=%s count=%d, ledger points=%s weight=%s count=%d",
            userId,
            stored.getTotalPoints().toPlainString(), stored.getTotalWeightKg().toPlainString(), stored.getDepositCount(),
            expected.getTotalPoints().toPlainString(), expected.getTotalWeightKg().toPlainString(), expected.getDepositCount()));
        this.userId = userId;
        this.stored = stored;
        this.expected = expected;
    }
}
