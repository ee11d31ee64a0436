package com.flagship.recycling_ledger.deposit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Generated;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the append-only deposits table.
 *
 * Every column is {@code updatable = false} and there are no mutators; the
 * database trigger {@code trg_deposits_append_only} rejects UPDATE and DELETE
 * for anything that bypasses JPA.
 */
@Entity
@Table(
    name = "deposits",
    indexes = {
        @Index(name = "idx_deposits_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_deposits_machine_created", columnList = "machine_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DepositEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true, length = 40)
    private String transactionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "machine_id", nullable = false, updatable = false)
    private UUID machineId;

    @Column(name = "machine_code", nullable = false, updatable = false, length = 20)
    private String machineCode;

    @Column(name = "material_id", nullable = false, updatable = false)
    private UUID materialId;

    @Column(name = "material_name", nullable = false, updatable = false, length = 50)
    private String materialName;

    @Column(name = "weight_kg", nullable = false, updatable = false, precision = 8, scale = 3)
    private BigDecimal weightKg;

    @Column(name = "points_per_kg", nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal pointsPerKg;

    @Column(name = "points_earned", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal pointsEarned;

    @Column(name = "notes", updatable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static DepositEntity fromDomain(Deposit deposit) {
        return new DepositEntity(
            deposit.getId(),
            null, // sequenceNumber - assigned by the database
            deposit.getTransactionId(),
            deposit.getUserId(),
            deposit.getMachineId(),
            deposit.getMachineCode(),
            deposit.getMaterialId(),
            deposit.getMaterialName(),
            deposit.getWeightKg(),
            deposit.getPointsPerKg(),
            deposit.getPointsEarned(),
            deposit.getNotes(),
            deposit.getCreatedAt()
        );
    }

    public Deposit toDomain() {
        return new Deposit(
            id,
            sequenceNumber,
            transactionId,
            userId,
            machineId,
            machineCode,
            materialId,
            materialName,
            weightKg,
            pointsPerKg,
            pointsEarned,
            notes,
            createdAt
        );
    }
}
