package com.flagship.recycling_ledger.totals;

import com.flagship.recycling_ledger.observability.DepositMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Consistency audit of user totals against the ledger.
 *
 * A rebuild from the ledger is the oracle: any difference between the stored
 * totals and a recomputation is drift, i.e. a bug, and is logged at ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregateAuditService {

    private final AggregateProjector projector;
    private final DepositMetrics metrics;
    private final Clock clock;

    /**
     * Compares a user's stored totals with a ledger recomputation.
     *
     * Both reads share one REPEATABLE READ snapshot, so an in-flight deposit
     * cannot produce a false alarm.
     *
     * @return the stored totals, which are known to be consistent
     * @throws AggregateInconsistencyException if they differ
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public UserTotals audit(UUID userId) {
        UserTotals stored = projector.getTotals(userId);
        UserTotals expected = projector.recompute(userId);

        if (!stored.sameTotalsAs(expected)) {
            metrics.recordDriftDetected();
            AggregateInconsistencyException inconsistency =
                new AggregateInconsistencyException(userId, stored, expected);
            log.error(inconsistency.getMessage());
            throw inconsistency;
        }

        log.debug("Totals of user {} match the ledger", userId);
        return stored;
    }

    /**
     * Finds every drifted user and repairs each one with a rebuild.
     * A failed repair is logged and reported; the pass continues with the next user.
     */
    public ReconciliationReport reconcileAll() {
        Instant startedAt = clock.instant();
        List<UUID> drifted = projector.findDriftedUsers();
        List<UUID> repaired = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();

        for (UUID userId : drifted) {
            metrics.recordDriftDetected();
            UserTotals stored = projector.getTotals(userId);
            log.error("Totals drift detected for user {}: stored points={} weight={} count={}; rebuilding",
                userId, stored.getTotalPoints(), stored.getTotalWeightKg(), stored.getDepositCount());
            try {
                projector.rebuild(userId);
                repaired.add(userId);
            } catch (Exception e) {
                log.error("Failed to rebuild totals of user {}", userId, e);
                failed.add(userId);
            }
        }

        ReconciliationReport report = new ReconciliationReport(
            List.copyOf(drifted), List.copyOf(repaired), List.copyOf(failed), startedAt, clock.instant());

        if (report.isClean()) {
            log.info("Totals reconciliation found no drift");
        } else {
            log.warn("Totals reconciliation: drifted={}, repaired={}, failed={}",
                drifted.size(), repaired.size(), failed.size());
        }
        return report;
    }
}
