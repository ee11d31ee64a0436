package com.flagship.recycling_ledger.totals;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.recycling_ledger.catalog.CatalogService;
import com.flagship.recycling_ledger.deposit.DepositCommand;
import com.flagship.recycling_ledger.deposit.DepositLedgerService;
import com.flagship.recycling_ledger.outbox.OutboxEvent;
import com.flagship.recycling_ledger.outbox.OutboxService;
import com.flagship.recycling_ledger.totals.event.UserTotalsRebuiltEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Totals vs. ledger: the incremental path, rebuilds, drift detection and repair.
 *
 * Guard limits are raised so bursts of deposits from one user are accepted.
 */
@SpringBootTest
@Testcontainers
class AggregateConsistencyTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("recycling_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("totals.reconciliation.enabled", () -> "false");
        registry.add("deposit.guard.store", () -> "in-memory");
        registry.add("deposit.guard.daily-deposit-limit", () -> "1000");
        registry.add("deposit.guard.velocity-limit", () -> "1000");
        registry.add("deposit.guard.machine-daily-capacity-kg", () -> "100000");
    }

    @Autowired
    private DepositLedgerService ledgerService;

    @Autowired
    private AggregateProjector projector;

    @Autowired
    private AggregateAuditService auditService;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID userId;
    private String machineCode;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        machineCode = "A-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        catalogService.registerMachine(machineCode, "Consistency Lab", null, null);
    }

    private boolean driftCorrected(OutboxEvent event) {
        try {
            return objectMapper.readTree(event.getPayload()).path("driftCorrected").asBoolean();
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable payload: " + event.getPayload(), e);
        }
    }

    private void deposit(UUID user, String material, String weight) {
        ledgerService.createDeposit(new DepositCommand(user, machineCode, material, new BigDecimal(weight), null));
    }

    @Nested
    @DisplayName("Incremental totals vs. rebuild")
    class IncrementalVsRebuild {

        @Test
        @DisplayName("Totals after a series of deposits equal a rebuild from the ledger")
        void incrementalMatchesRebuild() {
            printTestHeader("Incremental vs rebuild");

            deposit(userId, "Plastic", "2.5");
            deposit(userId, "Metal", "1.5");
            deposit(userId, "Glass", "0.333");
            deposit(userId, "Metal", "0.007");

            UserTotals incremental = projector.getTotals(userId);
            UserTotals rebuilt = projector.rebuild(userId);

            printOutput("Incremental", incremental);
            printOutput("Rebuilt", rebuilt);
            // 2.50 + 4.50 + 0.67 + 0.02
            assertEquals(new BigDecimal("7.69"), incremental.getTotalPoints());
            assertEquals(new BigDecimal("4.340"), incremental.getTotalWeightKg());
            assertEquals(4, incremental.getDepositCount());
            assertTrue(incremental.sameTotalsAs(rebuilt));
            assertEquals(incremental.getTotalPoints(), rebuilt.getTotalPoints());
            assertNotNull(projector.getTotals(userId).getRebuiltAt());

            printSuccess("Both paths agree to the cent and the gram");
        }

        @Test
        @DisplayName("Rebuild of a user without deposits yields zeros")
        void rebuildWithoutDeposits() {
            UserTotals rebuilt = projector.rebuild(userId);

            assertEquals(new BigDecimal("0.00"), rebuilt.getTotalPoints());
            assertEquals(new BigDecimal("0.000"), rebuilt.getTotalWeightKg());
            assertEquals(0, rebuilt.getDepositCount());
            auditService.audit(userId);
        }

        @Test
        @DisplayName("Rebuild is idempotent and records a UserTotalsRebuilt event")
        void rebuildIsIdempotent() {
            deposit(userId, "Plastic", "4");

            UserTotals first = projector.rebuild(userId);
            UserTotals second = projector.rebuild(userId);

            assertTrue(first.sameTotalsAs(second));
            List<OutboxEvent> rebuiltEvents = outboxService.getEventsForUser(userId).stream()
                .filter(e -> UserTotalsRebuiltEvent.EVENT_TYPE.equals(e.getEventType()))
                .toList();
            assertEquals(2, rebuiltEvents.size());
            assertFalse(driftCorrected(rebuiltEvents.get(0)));
        }

        @Test
        @DisplayName("Concurrent deposits of one user lose no update")
        void concurrentDepositsOfOneUser() throws Exception {
            printTestHeader("Concurrent deposits, same user");

            int threadCount = 20;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            AtomicInteger successCount = new AtomicInteger(0);
            AtomicInteger failureCount = new AtomicInteger(0);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                // Distinct weights so no submission is a duplicate of another
                String weight = "1." + String.format("%03d", i + 1);
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        deposit(userId, "Plastic", weight);
                        successCount.incrementAndGet();
                    } catch (Exception e) {
                        failureCount.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            UserTotals stored = projector.getTotals(userId);
            UserTotals ledger = projector.recompute(userId);

            printOutput("Accepted", successCount.get());
            printOutput("Stored", stored);
            assertEquals(threadCount, successCount.get());
            assertEquals(0, failureCount.get());
            assertEquals(threadCount, stored.getDepositCount());
            // 20 kg plus 0.001 * (1 + ... + 20)
            assertEquals(new BigDecimal("20.210"), stored.getTotalWeightKg());
            assertTrue(stored.sameTotalsAs(ledger));
            auditService.audit(userId);

            printSuccess("Every concurrent deposit is reflected exactly once");
        }

        @Test
        @DisplayName("Deposits of different users touch only their own totals")
        void usersAreIsolated() {
            UUID otherUser = UUID.randomUUID();

            deposit(userId, "Plastic", "1");
            deposit(otherUser, "Metal", "2");

            assertEquals(new BigDecimal("1.00"), projector.getTotals(userId).getTotalPoints());
            assertEquals(new BigDecimal("6.00"), projector.getTotals(otherUser).getTotalPoints());
        }
    }

    @Nested
    @DisplayName("Drift detection and repair")
    class DriftDetection {

        @Test
        @DisplayName("Audit raises AggregateInconsistencyException on injected drift")
        void auditDetectsDrift() {
            printTestHeader("Injected drift");
            deposit(userId, "Plastic", "3");

            jdbcTemplate.update("UPDATE user_totals SET total_points = total_points + 1 WHERE user_id = ?", userId);

            AggregateInconsistencyException e = assertThrows(AggregateInconsistencyException.class,
                () -> auditService.audit(userId));

            printOutput("Error", e.getMessage());
            assertEquals(userId, e.getUserId());
            assertEquals(new BigDecimal("4.00"), e.getStored().getTotalPoints());
            assertEquals(new BigDecimal("3.00"), e.getExpected().getTotalPoints());

            printSuccess("Drift reported, not silently accepted");
        }

        @Test
        @DisplayName("Reconciliation repairs drifted users and leaves a clean ledger")
        void reconcileRepairsDrift() {
            printTestHeader("Reconcile all");
            UUID missingRowUser = UUID.randomUUID();
            deposit(userId, "Glass", "1.25");
            deposit(missingRowUser, "Plastic", "2");

            jdbcTemplate.update("UPDATE user_totals SET deposit_count = 7, total_weight_kg = 0 WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM user_totals WHERE user_id = ?", missingRowUser);

            List<UUID> drifted = projector.findDriftedUsers();
            assertTrue(drifted.contains(userId));
            assertTrue(drifted.contains(missingRowUser));

            ReconciliationReport report = auditService.reconcileAll();

            printOutput("Report", report);
            assertFalse(report.isClean());
            assertTrue(report.getRepairedUsers().containsAll(List.of(userId, missingRowUser)));
            assertTrue(report.getFailedUsers().isEmpty());

            UserTotals repaired = auditService.audit(userId);
            assertEquals(1, repaired.getDepositCount());
            assertEquals(new BigDecimal("2.50"), repaired.getTotalPoints());
            assertEquals(new BigDecimal("2.00"), auditService.audit(missingRowUser).getTotalPoints());
            assertTrue(projector.findDriftedUsers().isEmpty());

            boolean correctionRecorded = outboxService.getEventsForUser(userId).stream()
                .anyMatch(ev -> UserTotalsRebuiltEvent.EVENT_TYPE.equals(ev.getEventType())
                    && driftCorrected(ev));
            assertTrue(correctionRecorded);

            printSuccess("Drifted totals rebuilt from the ledger");
        }
    }
}
