package com.flagship.recycling_ledger.totals.event;

import com.flagship.recycling_ledger.deposit.event.LedgerEvent;
import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a user's totals are recomputed from the ledger.
 * {@code driftCorrected} is true when the rebuild changed the stored values.
 */
@Value
public class UserTotalsRebuiltEvent implements LedgerEvent {
    UUID eventId;
    UUID userId;
    BigDecimal previousTotalPoints;
    BigDecimal previousTotalWeightKg;
    long previousDepositCount;
    BigDecimal totalPoints;
    BigDecimal totalWeightKg;
    long depositCount;
    boolean driftCorrected;
    Instant occurredAt;

    public static final String EVENT_TYPE = "UserTotalsRebuilt";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static UserTotalsRebuiltEvent of(UserTotals previous, UserTotals rebuilt) {
        return new UserTotalsRebuiltEvent(
            UUID.randomUUID(),
            rebuilt.getUserId(),
            previous.getTotalPoints(),
            previous.getTotalWeightKg(),
            previous.getDepositCount(),
            rebuilt.getTotalPoints(),
            rebuilt.getTotalWeightKg(),
            rebuilt.getDepositCount(),
            !previous.sameTotalsAs(rebuilt),
            rebuilt.getRebuiltAt()
        );
    }
}
