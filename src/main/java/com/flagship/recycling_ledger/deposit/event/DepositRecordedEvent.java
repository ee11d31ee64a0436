package com.flagship.recycling_ledger.deposit.event;

import com.flagship.recycling_ledger.deposit.Deposit;
import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a deposit is appended to the ledger. Carries the user's
 * totals as of that deposit.
 */
@Value
public class DepositRecordedEvent implements LedgerEvent {
    UUID eventId;
    UUID userId;
    UUID depositId;
    String transactionId;
    String machineCode;
    String materialName;
    BigDecimal weightKg;
    BigDecimal pointsPerKg;
    BigDecimal pointsEarned;
    BigDecimal totalPoints;
    BigDecimal totalWeightKg;
    long depositCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DepositRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DepositRecordedEvent of(Deposit deposit, UserTotals totals) {
        return new DepositRecordedEvent(
            UUID.randomUUID(),
            deposit.getUserId(),
            deposit.getId(),
            deposit.getTransactionId(),
            deposit.getMachineCode(),
            deposit.getMaterialName(),
            deposit.getWeightKg(),
            deposit.getPointsPerKg(),
            deposit.getPointsEarned(),
            totals.getTotalPoints(),
            totals.getTotalWeightKg(),
            totals.getDepositCount(),
            deposit.getCreatedAt()
        );
    }
}
