package com.flagship.recycling_ledger.totals;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one reconciliation pass over all users.
 */
@Value
public class ReconciliationReport {
    List<UUID> driftedUsers;
    List<UUID> repairedUsers;
    List<UUID> failedUsers;
    Instant startedAt;
    Instant finishedAt;

    public boolean isClean() {
        return driftedUsers.isEmpty();
    }
}
