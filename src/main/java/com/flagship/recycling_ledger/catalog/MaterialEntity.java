package com.flagship.recycling_ledger.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the materials table.
 *
 * No setters: the rate and the active flag change only through
 * {@link #changeRate(BigDecimal)} and {@link #setActive(boolean)}.
 */
@Entity
@Table(name = "materials")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MaterialEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 50)
    private String name;

    @Column(name = "points_per_kg", nullable = false, precision = 7, scale = 2)
    private BigDecimal pointsPerKg;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static MaterialEntity create(String name, BigDecimal pointsPerKg, String description) {
        return new MaterialEntity(UUID.randomUUID(), name, pointsPerKg, description, true, null, null);
    }

    void changeRate(BigDecimal pointsPerKg) {
        this.pointsPerKg = pointsPerKg;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    public Material toDomain() {
        return new Material(id, name, pointsPerKg, description, active);
    }
}
