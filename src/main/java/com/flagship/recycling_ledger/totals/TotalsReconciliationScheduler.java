package com.flagship.recycling_ledger.totals;

import com.flagship.recycling_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the totals reconciliation periodically.
 */
@Component
@ConditionalOnProperty(name = "totals.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TotalsReconciliationScheduler {

    private final AggregateAuditService auditService;

    @Scheduled(
        initialDelayString = "${totals.reconciliation.interval-ms:3600000}",
        fixedDelayString = "${totals.reconciliation.interval-ms:3600000}")
    public void reconcile() {
        CorrelationContext.bindJobCorrelationId("reconcile");
        try {
            auditService.reconcileAll();
        } catch (Exception e) {
            log.error("Totals reconciliation pass failed", e);
        } finally {
            CorrelationContext.clearAll();
        }
    }
}
