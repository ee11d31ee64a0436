package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.catalog.CatalogService;
import com.flagship.recycling_ledger.catalog.Machine;
import com.flagship.recycling_ledger.catalog.Material;
import com.flagship.recycling_ledger.deposit.event.DepositRecordedEvent;
import com.flagship.recycling_ledger.deposit.exception.DepositRejectedException;
import com.flagship.recycling_ledger.deposit.exception.RejectionReason;
import com.flagship.recycling_ledger.deposit.guard.DepositGuard;
import com.flagship.recycling_ledger.deposit.guard.GuardReservation;
import com.flagship.recycling_ledger.observability.CorrelationContext;
import com.flagship.recycling_ledger.observability.DepositMetrics;
import com.flagship.recycling_ledger.outbox.OutboxService;
import com.flagship.recycling_ledger.totals.AggregateProjector;
import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Turns a deposit submission into a ledger entry and a totals update.
 *
 * One transaction covers:
 * 1. resolving machine and material (active only)
 * 2. guard checks
 * 3. points = round(weight * current rate, 2)
 * 4. appending the entry with a fresh transaction ID
 * 5. adding the entry to the user's totals
 * 6. writing the DepositRecorded event to the outbox
 *
 * Either all of it commits or none of it does. Guard state claimed in the
 * shared store is given back if the transaction does not commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositLedgerService {

    private final CatalogService catalogService;
    private final DepositGuard depositGuard;
    private final RewardCalculator rewardCalculator;
    private final TransactionIdGenerator transactionIdGenerator;
    private final DepositRepository depositRepository;
    private final AggregateProjector aggregateProjector;
    private final OutboxService outboxService;
    private final DepositMetrics depositMetrics;
    private final Clock clock;

    @Transactional
    public DepositReceipt createDeposit(DepositCommand command) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.bindUser(command.getUserId());

        try {
            if (command.getUserId() == null) {
                throw new IllegalArgumentException("User ID is required");
            }

            Machine machine = catalogService.lookupMachine(command.getMachineCode())
                .orElseThrow(() -> new DepositRejectedException(RejectionReason.INVALID_REFERENCE,
                    "Unknown or inactive machine: " + command.getMachineCode(),
                    Map.of("machineId", String.valueOf(command.getMachineCode()))));
            Material material = catalogService.lookupMaterial(command.getMaterialName())
                .orElseThrow(() -> new DepositRejectedException(RejectionReason.INVALID_REFERENCE,
                    "Unknown or inactive material: " + command.getMaterialName(),
                    Map.of("material", String.valueOf(command.getMaterialName()))));

            GuardReservation reservation = depositGuard.check(
                command.getUserId(), machine, material, command.getWeightKg());
            releaseOnRollback(reservation);

            BigDecimal points = rewardCalculator.pointsFor(command.getWeightKg(), material.getPointsPerKg());
            String transactionId = transactionIdGenerator.next();
            CorrelationContext.bindTransaction(transactionId);

            Deposit deposit = Deposit.record(
                transactionId,
                command.getUserId(),
                machine,
                material,
                command.getWeightKg(),
                points,
                normalizeNotes(command.getNotes()),
                clock.instant()
            );

            Deposit saved = depositRepository.saveAndFlush(DepositEntity.fromDomain(deposit)).toDomain();
            UserTotals totals = aggregateProjector.applyDeposit(
                saved.getUserId(), saved.getWeightKg(), saved.getPointsEarned());

            outboxService.saveEvent(DepositRecordedEvent.of(saved, totals));

            long duration = System.currentTimeMillis() - startTime;
            depositMetrics.recordAccepted(material.getName(), points);
            depositMetrics.recordLatency("accepted", Duration.ofMillis(duration));

            log.info("Deposit accepted: machine={}, material={}, weightKg={}, points={}, totalPoints={}, duration={}ms",
                machine.getMachineCode(), material.getName(), saved.getWeightKg(), points,
                totals.getTotalPoints(), duration);

            return new DepositReceipt(saved, totals);

        } catch (DepositRejectedException e) {
            depositMetrics.recordRejected(e.getReason());
            depositMetrics.recordLatency(e.getReason().name(), Duration.ofMillis(System.currentTimeMillis() - startTime));
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            depositMetrics.recordLatency("error", Duration.ofMillis(duration));
            log.error("Deposit failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            CorrelationContext.clearDeposit();
        }
    }

    private void releaseOnRollback(GuardReservation reservation) {
        if (reservation.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        depositGuard.release(reservation);
                    }
                }
            });
        } else {
            log.warn("No transaction synchronization active; guard reservation will not be released on failure");
        }
    }

    private static String normalizeNotes(String notes) {
        if (notes == null || notes.isBlank()) {
            return null;
        }
        return notes.strip();
    }
}
