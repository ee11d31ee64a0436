package com.flagship.recycling_ledger.deposit.guard;

import com.flagship.recycling_ledger.catalog.Machine;
import com.flagship.recycling_ledger.catalog.Material;
import com.flagship.recycling_ledger.deposit.DepositRepository;
import com.flagship.recycling_ledger.deposit.exception.DepositRejectedException;
import com.flagship.recycling_ledger.deposit.exception.RejectionReason;
import com.flagship.recycling_ledger.observability.DepositMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

/**
 * Pre-write fraud and capacity checks for a deposit.
 *
 * Checks run in this order and the first failure wins:
 * 1. weight bound (input validation)
 * 2. daily count (ledger)
 * 3. velocity (ledger)
 * 4. duplicate fingerprint (shared store, set-if-absent)
 * 5. machine daily capacity (shared store, atomic increment)
 *
 * The two shared-store checks claim state while they pass. The caller must hand
 * the returned reservation back to {@link #release} if the deposit is not committed.
 * If the store is unreachable these two checks are skipped: losing them degrades
 * fraud protection but never blocks or corrupts the ledger.
 */
@Component
@Slf4j
public class DepositGuard {

    static final String DUPLICATE_KEY_PREFIX = "guard:dup:";
    static final String CAPACITY_KEY_PREFIX = "guard:machine:";
    static final int MAX_WEIGHT_SCALE = 3;

    private final DepositRepository depositRepository;
    private final KeyValueStore store;
    private final GuardPolicy policy;
    private final Clock clock;
    private final DepositMetrics metrics;

    public DepositGuard(DepositRepository depositRepository,
                        KeyValueStore store,
                        GuardPolicy policy,
                        Clock clock,
                        DepositMetrics metrics) {
        this.depositRepository = depositRepository;
        this.store = store;
        this.policy = policy;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs every check for the given submission.
     *
     * @return the shared-store claims made by the passed checks
     * @throws DepositRejectedException with the reason of the first failed check
     */
    public GuardReservation check(UUID userId, Machine machine, Material material, BigDecimal weightKg) {
        checkWeight(weightKg);

        Instant now = clock.instant();
        checkDailyLimit(userId, now);
        checkVelocity(userId, now);

        String duplicateKey = claimFingerprint(userId, machine, material, weightKg);
        try {
            long grams = toGrams(weightKg);
            String capacityKey = claimCapacity(machine, grams, now);
            return new GuardReservation(duplicateKey, capacityKey, capacityKey != null ? grams : 0);
        } catch (RuntimeException e) {
            // Nothing was accepted, so the fingerprint must not block a retry
            release(new GuardReservation(duplicateKey, null, 0));
            throw e;
        }
    }

    /**
     * Gives back the shared-store state claimed by {@link #check}. Best effort:
     * store failures are logged, never thrown.
     */
    public void release(GuardReservation reservation) {
        if (reservation == null || reservation.isEmpty()) {
            return;
        }
        try {
            if (reservation.getDuplicateKey() != null) {
                store.delete(reservation.getDuplicateKey());
            }
            if (reservation.getCapacityKey() != null && reservation.getReservedGrams() > 0) {
                store.incrementBy(reservation.getCapacityKey(), -reservation.getReservedGrams(), Duration.ofHours(1));
            }
            log.debug("Released guard reservation: {}", reservation);
        } catch (Exception e) {
            log.warn("Failed to release guard reservation {}. Error: {}", reservation, e.getMessage());
        }
    }

    // ==================== Ledger-backed checks ====================

    void checkWeight(BigDecimal weightKg) {
        if (weightKg == null) {
            reject(RejectionReason.INVALID_WEIGHT, "Weight is required", Map.of());
        }
        if (weightKg.signum() <= 0) {
            reject(RejectionReason.INVALID_WEIGHT, "Weight must be positive",
                Map.of("weightKg", weightKg.toPlainString()));
        }
        if (weightKg.compareTo(policy.getMaxWeightKg()) > 0) {
            reject(RejectionReason.INVALID_WEIGHT,
                "Weight exceeds the per-deposit maximum of " + policy.getMaxWeightKg().toPlainString() + " kg",
                Map.of("weightKg", weightKg.toPlainString(),
                       "maxWeightKg", policy.getMaxWeightKg().toPlainString()));
        }
        if (weightKg.stripTrailingZeros().scale() > MAX_WEIGHT_SCALE) {
            reject(RejectionReason.INVALID_WEIGHT, "Weight supports at most 3 decimal places",
                Map.of("weightKg", weightKg.toPlainString()));
        }
    }

    private void checkDailyLimit(UUID userId, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, policy.getZone());
        Instant dayStart = today.atStartOfDay(policy.getZone()).toInstant();
        Instant dayEnd = today.plusDays(1).atStartOfDay(policy.getZone()).toInstant();

        long todayCount = depositRepository.countForUserBetween(userId, dayStart, dayEnd);
        if (todayCount >= policy.getDailyDepositLimit()) {
            reject(RejectionReason.DAILY_LIMIT_EXCEEDED,
                "Daily deposit limit of " + policy.getDailyDepositLimit() + " reached",
                Map.of("count", String.valueOf(todayCount),
                       "limit", String.valueOf(policy.getDailyDepositLimit())));
        }
    }

    private void checkVelocity(UUID userId, Instant now) {
        Instant since = now.minus(policy.getVelocityWindow());
        long recentCount = depositRepository.countForUserSince(userId, since);
        if (recentCount > policy.getVelocityLimit()) {
            reject(RejectionReason.VELOCITY_LIMIT_EXCEEDED,
                "Too many deposits in the last " + policy.getVelocityWindow().toMinutes() + " minutes",
                Map.of("count", String.valueOf(recentCount),
                       "limit", String.valueOf(policy.getVelocityLimit())));
        }
    }

    // ==================== Shared-store checks ====================

    private String claimFingerprint(UUID userId, Machine machine, Material material, BigDecimal weightKg) {
        String key = DUPLICATE_KEY_PREFIX + fingerprint(userId, weightKg, material.getId(), machine.getId());
        boolean created;
        try {
            created = store.setIfAbsent(key, clock.instant().toString(), policy.getDuplicateWindow());
        } catch (Exception e) {
            log.warn("Guard store unavailable, skipping duplicate check. Error: {}", e.getMessage());
            metrics.recordGuardStoreUnavailable("duplicate");
            return null;
        }
        if (!created) {
            reject(RejectionReason.DUPLICATE_SUBMISSION,
                "Identical deposit submitted within the last " + policy.getDuplicateWindow().toSeconds() + " seconds",
                Map.of("machineId", machine.getMachineCode(), "material", material.getName()));
        }
        return key;
    }

    private String claimCapacity(Machine machine, long grams, Instant now) {
        ZonedDateTime zonedNow = now.atZone(policy.getZone());
        LocalDate today = zonedNow.toLocalDate();
        String key = CAPACITY_KEY_PREFIX + machine.getMachineCode().toUpperCase() + ":" + today;
        // Keep the counter for the rest of the day plus a margin
        Duration ttl = Duration.between(zonedNow, today.plusDays(1).atStartOfDay(policy.getZone()))
            .plusHours(1);

        long total;
        try {
            total = store.incrementBy(key, grams, ttl);
        } catch (Exception e) {
            log.warn("Guard store unavailable, skipping capacity check for machine {}. Error: {}",
                machine.getMachineCode(), e.getMessage());
            metrics.recordGuardStoreUnavailable("capacity");
            return null;
        }

        long ceiling = toGrams(policy.getMachineDailyCapacityKg());
        if (total > ceiling) {
            try {
                store.incrementBy(key, -grams, ttl);
            } catch (Exception e) {
                log.warn("Failed to roll back capacity claim on {}. Error: {}", key, e.getMessage());
            }
            reject(RejectionReason.MACHINE_CAPACITY_EXCEEDED,
                "Machine " + machine.getMachineCode() + " has reached its daily capacity",
                Map.of("machineId", machine.getMachineCode(),
                       "capacityKg", policy.getMachineDailyCapacityKg().toPlainString()));
        }
        return key;
    }

    /**
     * Stable fingerprint of a submission. Weights that differ only in trailing
     * zeros produce the same fingerprint.
     */
    static String fingerprint(UUID userId, BigDecimal weightKg, UUID materialId, UUID machineId) {
        String raw = userId + "|" + weightKg.stripTrailingZeros().toPlainString() + "|" + materialId + "|" + machineId;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static long toGrams(BigDecimal kilograms) {
        return kilograms.movePointRight(3).setScale(0, RoundingMode.DOWN).longValueExact();
    }

    private void reject(RejectionReason reason, String message, Map<String, String> details) {
        log.warn("Deposit rejected: reason={}, message={}", reason, message);
        throw new DepositRejectedException(reason, message, details);
    }
}
