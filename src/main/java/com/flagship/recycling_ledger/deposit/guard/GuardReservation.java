package com.flagship.recycling_ledger.deposit.guard;

import lombok.Value;

/**
 * Shared-store state claimed by a passed fraud check. Released again if the
 * deposit that claimed it is never committed.
 *
 * Either key may be null when the store was unavailable during the check.
 */
@Value
public class GuardReservation {
    String duplicateKey;
    String capacityKey;
    long reservedGrams;

    public static GuardReservation none() {
        return new GuardReservation(null, null, 0);
    }

    public boolean isEmpty() {
        return duplicateKey == null && capacityKey == null;
    }
}
