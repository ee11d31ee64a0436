package com.flagship.recycling_ledger.observability;

import com.flagship.recycling_ledger.deposit.exception.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for deposits and user totals.
 *
 * Metrics exposed:
 * - deposit.accepted: accepted deposits, tagged by material
 * - deposit.rejected: rejected deposits, tagged by reason
 * - deposit.points.awarded: distribution of points per accepted deposit
 * - deposit.latency: create-deposit latency, tagged by outcome
 * - deposit.guard.store.unavailable: guard checks skipped because the shared store failed
 * - totals.drift.detected: users whose stored totals disagreed with the ledger
 * - totals.rebuilt: full rebuilds of a user's totals
 */
@Component
public class DepositMetrics {

    private final MeterRegistry registry;

    private final DistributionSummary pointsAwarded;
    private final Counter driftDetected;
    private final Counter totalsRebuilt;

    public DepositMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pointsAwarded = DistributionSummary.builder("deposit.points.awarded")
                .description("Points awarded per accepted deposit")
                .baseUnit("points")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.driftDetected = Counter.builder("totals.drift.detected")
                .description("Users whose stored totals disagreed with the ledger")
                .register(registry);

        this.totalsRebuilt = Counter.builder("totals.rebuilt")
                .description("Full rebuilds of user totals from the ledger")
                .register(registry);
    }

    // ==================== Deposit Methods ====================

    public void recordAccepted(String materialName, BigDecimal pointsEarned) {
        registry.counter("deposit.accepted",
                "material", sanitizeTag(materialName)
        ).increment();
        pointsAwarded.record(pointsEarned.doubleValue());
    }

    public void recordRejected(RejectionReason reason) {
        registry.counter("deposit.rejected",
                "reason", reason.name()
        ).increment();
    }

    /**
     * Records create-deposit latency. Outcome is "accepted", a rejection reason, or "error".
     */
    public void recordLatency(String outcome, Duration duration) {
        registry.timer("deposit.latency",
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    public void recordGuardStoreUnavailable(String check) {
        registry.counter("deposit.guard.store.unavailable",
                "check", sanitizeTag(check)
        ).increment();
    }

    // ==================== Totals Methods ====================

    public void recordDriftDetected() {
        driftDetected.increment();
    }

    public void recordTotalsRebuilt() {
        totalsRebuilt.increment();
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
