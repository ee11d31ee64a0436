package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.catalog.Machine;
import com.flagship.recycling_ledger.catalog.Material;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One accepted recycling deposit: the unit of truth for points awarded.
 *
 * Invariants:
 * - pointsEarned == round(weightKg * pointsPerKg, 2), computed once at write time
 * - pointsPerKg is the material rate in force at that moment, copied into the entry
 * - entries are never updated or deleted
 *
 * Machine code and material name are snapshotted too, so the ledger reads on its
 * own even after catalog changes.
 */
@Value
public class Deposit {
    UUID id;
    Long sequenceNumber;
    String transactionId;
    UUID userId;
    UUID machineId;
    String machineCode;
    UUID materialId;
    String materialName;
    BigDecimal weightKg;
    BigDecimal pointsPerKg;
    BigDecimal pointsEarned;
    String notes;
    Instant createdAt;

    /**
     * Creates a new, not yet persisted, ledger entry. The sequence number is
     * assigned by the database.
     */
    public static Deposit record(String transactionId, UUID userId, Machine machine, Material material,
                                 BigDecimal weightKg, BigDecimal pointsEarned, String notes, Instant createdAt) {
        return new Deposit(
            UUID.randomUUID(),
            null,
            transactionId,
            userId,
            machine.getId(),
            machine.getMachineCode(),
            material.getId(),
            material.getName(),
            weightKg,
            material.getPointsPerKg(),
            pointsEarned,
            notes,
            createdAt
        );
    }
}
