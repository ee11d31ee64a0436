package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.catalog.CatalogService;
import com.flagship.recycling_ledger.deposit.event.DepositRecordedEvent;
import com.flagship.recycling_ledger.deposit.exception.DepositRejectedException;
import com.flagship.recycling_ledger.deposit.exception.RejectionReason;
import com.flagship.recycling_ledger.outbox.OutboxEvent;
import com.flagship.recycling_ledger.outbox.OutboxService;
import com.flagship.recycling_ledger.totals.AggregateAuditService;
import com.flagship.recycling_ledger.totals.AggregateProjector;
import com.flagship.recycling_ledger.totals.UserTotals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deposit ledger: reward formula, guard rejections, atomicity and append-only entries.
 *
 * The machine capacity is lowered to 100 kg so the ceiling is reachable.
 */
@SpringBootTest
@Testcontainers
class DepositLedgerServiceTest {

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
        // No Kafka, Redis or background jobs for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("totals.reconciliation.enabled", () -> "false");
        registry.add("deposit.guard.store", () -> "in-memory");
        registry.add("deposit.guard.machine-daily-capacity-kg", () -> "100");
    }

    @Autowired
    private DepositLedgerService ledgerService;

    @Autowired
    private DepositRepository depositRepository;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private AggregateProjector projector;

    @Autowired
    private AggregateAuditService auditService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID userId;
    private String machineCode;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        // Ledger rows cannot be deleted, so every test gets its own user and machine
        userId = UUID.randomUUID();
        machineCode = "T-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        catalogService.registerMachine(machineCode, "Test Hall", null, null);
    }

    private DepositReceipt deposit(UUID user, String material, String weight) {
        return ledgerService.createDeposit(
            new DepositCommand(user, machineCode, material, new BigDecimal(weight), null));
    }

    private RejectionReason rejectionOf(UUID user, String material, String weight) {
        DepositRejectedException e = assertThrows(DepositRejectedException.class,
            () -> deposit(user, material, weight));
        printOutput("Rejection", e.getReason() + " - " + e.getMessage());
        return e.getReason();
    }

    @Nested
    @DisplayName("Accepted deposits")
    class AcceptedDeposits {

        @Test
        @DisplayName("Deposit is recorded with frozen points and reflected in totals")
        void createDeposit_recordsEntryAndTotals() {
            printTestHeader("Create deposit");
            printInput("Deposit", "2.5 kg Plastic @ 1.00");

            DepositReceipt receipt = ledgerService.createDeposit(
                new DepositCommand(userId, machineCode.toLowerCase(), "plastic", new BigDecimal("2.5"), "  bag 1 "));
            Deposit deposit = receipt.getDeposit();

            printOutput("Transaction", deposit.getTransactionId());
            assertEquals(new BigDecimal("2.50"), deposit.getPointsEarned());
            assertEquals(0, new BigDecimal("1.00").compareTo(deposit.getPointsPerKg()));
            assertEquals("Plastic", deposit.getMaterialName());
            assertEquals(machineCode, deposit.getMachineCode());
            assertEquals("bag 1", deposit.getNotes());
            assertTrue(deposit.getTransactionId().matches("^TXN-[0-9A-F]{24}$"));
            assertNotNull(deposit.getCreatedAt());

            UserTotals totals = receipt.getTotals();
            assertEquals(new BigDecimal("2.50"), totals.getTotalPoints());
            assertEquals(new BigDecimal("2.500"), totals.getTotalWeightKg());
            assertEquals(1, totals.getDepositCount());

            Deposit stored = depositRepository.findByTransactionId(deposit.getTransactionId())
                .orElseThrow().toDomain();
            assertEquals(new BigDecimal("2.50"), stored.getPointsEarned());
            assertNotNull(stored.getSequenceNumber());

            printSuccess("Entry and totals written together");
        }

        @Test
        @DisplayName("Points follow weight times rate for each material")
        void createDeposit_rewardFormula() {
            assertEquals(new BigDecimal("4.50"), deposit(userId, "Metal", "1.5").getDeposit().getPointsEarned());
            assertEquals(new BigDecimal("4.00"), deposit(userId, "Glass", "2.0").getDeposit().getPointsEarned());

            UserTotals totals = projector.getTotals(userId);
            assertEquals(new BigDecimal("8.50"), totals.getTotalPoints());
            assertEquals(new BigDecimal("3.500"), totals.getTotalWeightKg());
        }

        @Test
        @DisplayName("Accepted deposit writes a DepositRecorded event in the same transaction")
        void createDeposit_writesOutboxEvent() {
            DepositReceipt receipt = deposit(userId, "Plastic", "3");

            List<OutboxEvent> events = outboxService.getEventsForUser(userId);

            assertEquals(1, events.size());
            OutboxEvent event = events.get(0);
            assertEquals(DepositRecordedEvent.EVENT_TYPE, event.getEventType());
            assertEquals(OutboxService.LEDGER_AGGREGATE_TYPE, event.getAggregateType());
            assertTrue(event.getPayload().contains(receipt.getDeposit().getTransactionId()));
            assertFalse(event.isPublished());
        }

        @Test
        @DisplayName("Changing a material rate never alters existing entries")
        void rateChange_doesNotRewriteHistory() {
            printTestHeader("Rate change immutability");
            String material = "Foil-" + UUID.randomUUID().toString().substring(0, 6);
            catalogService.registerMaterial(material, new BigDecimal("2.00"), null);

            Deposit before = deposit(userId, material, "2").getDeposit();
            catalogService.changeMaterialRate(material, new BigDecimal("5.00"));
            Deposit after = deposit(userId, material, "3").getDeposit();

            Deposit reloaded = depositRepository.findByTransactionId(before.getTransactionId()).orElseThrow().toDomain();
            assertEquals(new BigDecimal("4.00"), reloaded.getPointsEarned());
            assertEquals(new BigDecimal("2.00"), reloaded.getPointsPerKg());
            assertEquals(new BigDecimal("15.00"), after.getPointsEarned());

            UserTotals rebuilt = projector.rebuild(userId);
            assertEquals(new BigDecimal("19.00"), rebuilt.getTotalPoints());
            auditService.audit(userId);

            printSuccess("Old entry keeps its original rate; rebuild agrees");
        }
    }

    @Nested
    @DisplayName("Rejected deposits")
    class RejectedDeposits {

        @Test
        @DisplayName("Unknown or inactive references are rejected and nothing is written")
        void invalidReference() {
            assertEquals(RejectionReason.INVALID_REFERENCE, rejectionOf(userId, "Styrofoam", "1"));

            DepositRejectedException e = assertThrows(DepositRejectedException.class,
                () -> ledgerService.createDeposit(
                    new DepositCommand(userId, "NOPE-999", "Plastic", BigDecimal.ONE, null)));
            assertEquals(RejectionReason.INVALID_REFERENCE, e.getReason());

            catalogService.setMachineActive(machineCode, false);
            assertEquals(RejectionReason.INVALID_REFERENCE, rejectionOf(userId, "Plastic", "1"));

            assertEquals(0, depositRepository.countByUserId(userId));
            assertEquals(0, projector.getTotals(userId).getDepositCount());
        }

        @Test
        @DisplayName("Weight bound: zero and negative rejected, ceiling accepted, ceiling + 1 g rejected")
        void weightBoundaries() {
            printTestHeader("Boundary weight");

            assertEquals(RejectionReason.INVALID_WEIGHT, rejectionOf(userId, "Plastic", "0"));
            assertEquals(RejectionReason.INVALID_WEIGHT, rejectionOf(userId, "Plastic", "-1"));
            assertEquals(RejectionReason.INVALID_WEIGHT, rejectionOf(userId, "Plastic", "50.001"));

            DepositReceipt atCeiling = deposit(userId, "Plastic", "50");
            assertEquals(new BigDecimal("50.00"), atCeiling.getDeposit().getPointsEarned());
            assertEquals(1, depositRepository.countByUserId(userId));

            printSuccess("Only the in-range weight was recorded");
        }

        @Test
        @DisplayName("Identical submission within 60 seconds is rejected and changes nothing")
        void duplicateSubmission() {
            printTestHeader("Duplicate rejection");

            deposit(userId, "Plastic", "2.5");
            UserTotals before = projector.getTotals(userId);

            assertEquals(RejectionReason.DUPLICATE_SUBMISSION, rejectionOf(userId, "PLASTIC", "2.50"));

            UserTotals after = projector.getTotals(userId);
            assertEquals(1, depositRepository.countByUserId(userId));
            assertTrue(before.sameTotalsAs(after));
            assertEquals(1, outboxService.getEventsForUser(userId).size());

            printSuccess("Second submission left ledger and totals unchanged");
        }

        @Test
        @DisplayName("Deposit that overflows the machine's daily capacity is rejected")
        void machineCapacity() {
            printTestHeader("Machine capacity");

            deposit(UUID.randomUUID(), "Plastic", "40");
            deposit(UUID.randomUUID(), "Plastic", "40");

            UUID overflowUser = UUID.randomUUID();
            assertEquals(RejectionReason.MACHINE_CAPACITY_EXCEEDED, rejectionOf(overflowUser, "Plastic", "30"));
            assertEquals(0, depositRepository.countByUserId(overflowUser));

            // Exactly filling the machine is still allowed
            deposit(overflowUser, "Plastic", "20");
            assertEquals(RejectionReason.MACHINE_CAPACITY_EXCEEDED, rejectionOf(UUID.randomUUID(), "Glass", "0.001"));

            printSuccess("Only the overflowing deposit was rejected");
        }

        @Test
        @DisplayName("More than 10 deposits in 5 minutes trips the velocity limit")
        void velocityLimit() {
            for (int i = 1; i <= 11; i++) {
                deposit(userId, "Plastic", "0." + (100 + i));
            }

            assertEquals(RejectionReason.VELOCITY_LIMIT_EXCEEDED, rejectionOf(userId, "Plastic", "0.5"));
            assertEquals(11, depositRepository.countByUserId(userId));
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("Rolled-back deposit leaves no entry, totals, event or guard claim")
        void rollback_leavesNoTrace() {
            printTestHeader("Rollback leaves no trace");
            DepositCommand command = new DepositCommand(userId, machineCode, "Plastic", new BigDecimal("30"), null);

            IllegalStateException failure = assertThrows(IllegalStateException.class,
                () -> transactionTemplate.executeWithoutResult(status -> {
                    ledgerService.createDeposit(command);
                    throw new IllegalStateException("Simulated failure after the ledger write");
                }));
            assertEquals("Simulated failure after the ledger write", failure.getMessage());

            assertEquals(0, depositRepository.countByUserId(userId));
            assertEquals(0, projector.getTotals(userId).getDepositCount());
            assertTrue(outboxService.getEventsForUser(userId).isEmpty());

            // Fingerprint and the 30 kg of capacity were given back: the same
            // deposit is not a duplicate, and 30 + 50 + 20 fills the 100 kg exactly
            ledgerService.createDeposit(command);
            ledgerService.createDeposit(new DepositCommand(userId, machineCode, "Plastic", new BigDecimal("50"), null));
            ledgerService.createDeposit(new DepositCommand(userId, machineCode, "Glass", new BigDecimal("20"), null));

            assertEquals(3, depositRepository.countByUserId(userId));
            auditService.audit(userId);

            printSuccess("Failed transaction left nothing behind");
        }

        @Test
        @DisplayName("Ledger entries cannot be updated or deleted")
        void ledgerIsAppendOnly() {
            Deposit deposit = deposit(userId, "Plastic", "1").getDeposit();

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE deposits SET points_earned = 999 WHERE id = ?", deposit.getId()));
            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM deposits WHERE id = ?", deposit.getId()));

            Deposit reloaded = depositRepository.findByTransactionId(deposit.getTransactionId())
                .orElseThrow().toDomain();
            assertEquals(new BigDecimal("1.00"), reloaded.getPointsEarned());
        }
    }
}
