package com.flagship.recycling_ledger.totals;

import com.flagship.recycling_ledger.observability.DepositMetrics;
import com.flagship.recycling_ledger.outbox.OutboxService;
import com.flagship.recycling_ledger.totals.event.UserTotalsRebuiltEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Maintains the user_totals projection of the deposit ledger.
 *
 * Two write paths, which must agree exactly for the same ledger state:
 * 1. {@link #applyDeposit}: a single-statement upsert that adds one entry,
 *    run inside the deposit's transaction
 * 2. {@link #rebuild}: recomputes a user's row from the ledger and overwrites it
 *
 * Both serialize on the user's user_totals row lock. Deposits of different
 * users never touch the same row and never block each other.
 */
@Service
@Slf4j
public class AggregateProjector {

    private static final String TOTALS_COLUMNS =
        "user_id, total_points, total_weight_kg, deposit_count, updated_at, rebuilt_at";

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final DepositMetrics metrics;
    private final Clock clock;

    public AggregateProjector(JdbcTemplate jdbcTemplate,
                              OutboxService outboxService,
                              DepositMetrics metrics,
                              Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Adds one ledger entry to the user's totals, creating the row if absent.
     *
     * Must run in the transaction that inserted the entry, so the entry and the
     * totals commit or roll back together. The upsert takes the row lock, so
     * concurrent deposits of the same user queue up and none is lost.
     *
     * @return the totals including this entry
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserTotals applyDeposit(UUID userId, BigDecimal weightKg, BigDecimal pointsEarned) {
        Timestamp now = Timestamp.from(clock.instant());
        return jdbcTemplate.queryForObject(
            "INSERT INTO user_totals (user_id, total_points, total_weight_kg, deposit_count, created_at, updated_at) " +
            "VALUES (?, ?, ?, 1, ?, ?) " +
            "ON CONFLICT (user_id) DO UPDATE SET " +
            "  total_points = user_totals.total_points + EXCLUDED.total_points, " +
            "  total_weight_kg = user_totals.total_weight_kg + EXCLUDED.total_weight_kg, " +
            "  deposit_count = user_totals.deposit_count + 1, " +
            "  updated_at = EXCLUDED.updated_at " +
            "RETURNING " + TOTALS_COLUMNS,
            totalsRowMapper(),
            userId, pointsEarned, weightKg, now, now
        );
    }

    /**
     * Recomputes a user's totals from the full ledger and overwrites the stored row.
     *
     * The row is locked before the ledger is summed. Under READ COMMITTED the
     * sum therefore sees every deposit whose totals update committed before the
     * lock was granted, and deposits committing afterwards add on top of the
     * rebuilt values. Safe to re-run at any time.
     *
     * @return the rebuilt totals
     */
    @Transactional
    public UserTotals rebuild(UUID userId) {
        Instant now = clock.instant();
        Timestamp nowTs = Timestamp.from(now);

        jdbcTemplate.update(
            "INSERT INTO user_totals (user_id, total_points, total_weight_kg, deposit_count, created_at, updated_at) " +
            "VALUES (?, 0, 0, 0, ?, ?) ON CONFLICT (user_id) DO NOTHING",
            userId, nowTs, nowTs
        );

        UserTotals previous = jdbcTemplate.queryForObject(
            "SELECT " + TOTALS_COLUMNS + " FROM user_totals WHERE user_id = ? FOR UPDATE",
            totalsRowMapper(),
            userId
        );

        UserTotals ledger = recompute(userId);

        jdbcTemplate.update(
            "UPDATE user_totals SET total_points = ?, total_weight_kg = ?, deposit_count = ?, " +
            "updated_at = ?, rebuilt_at = ? WHERE user_id = ?",
            ledger.getTotalPoints(), ledger.getTotalWeightKg(), ledger.getDepositCount(),
            nowTs, nowTs, userId
        );

        UserTotals rebuilt = UserTotals.of(userId, ledger.getTotalPoints(), ledger.getTotalWeightKg(),
            ledger.getDepositCount(), now, now);

        outboxService.saveEvent(UserTotalsRebuiltEvent.of(previous, rebuilt));
        metrics.recordTotalsRebuilt();

        if (!previous.sameTotalsAs(rebuilt)) {
            log.warn("Rebuild corrected totals of user {}: points {} -> {}, weight {} -> {}, count {} -> {}",
                userId,
                previous.getTotalPoints(), rebuilt.getTotalPoints(),
                previous.getTotalWeightKg(), rebuilt.getTotalWeightKg(),
                previous.getDepositCount(), rebuilt.getDepositCount());
        } else {
            log.info("Rebuilt totals of user {}: points={}, weight={}, count={}",
                userId, rebuilt.getTotalPoints(), rebuilt.getTotalWeightKg(), rebuilt.getDepositCount());
        }
        return rebuilt;
    }

    /**
     * Stored totals of a user; zeros if the user has never deposited.
     */
    @Transactional(readOnly = true)
    public UserTotals getTotals(UUID userId) {
        List<UserTotals> rows = jdbcTemplate.query(
            "SELECT " + TOTALS_COLUMNS + " FROM user_totals WHERE user_id = ?",
            totalsRowMapper(),
            userId
        );
        return rows.isEmpty() ? UserTotals.empty(userId) : rows.get(0);
    }

    /**
     * Sums the user's ledger entries without writing anything.
     */
    @Transactional(readOnly = true)
    public UserTotals recompute(UUID userId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(points_earned), 0) AS total_points, " +
            "       COALESCE(SUM(weight_kg), 0) AS total_weight_kg, " +
            "       COUNT(*) AS deposit_count " +
            "FROM deposits WHERE user_id = ?",
            (rs, rowNum) -> UserTotals.of(
                userId,
                rs.getBigDecimal("total_points"),
                rs.getBigDecimal("total_weight_kg"),
                rs.getLong("deposit_count"),
                null,
                null
            ),
            userId
        );
    }

    /**
     * Users whose stored row disagrees with the ledger, including users with
     * ledger entries but no row and rows with no ledger entries but non-zero totals.
     * Evaluated in one statement, so it never observes a half-applied deposit.
     */
    @Transactional(readOnly = true)
    public List<UUID> findDriftedUsers() {
        return jdbcTemplate.query(
            "SELECT COALESCE(t.user_id, d.user_id) AS user_id " +
            "FROM user_totals t " +
            "FULL OUTER JOIN ( " +
            "    SELECT user_id, SUM(points_earned) AS points, SUM(weight_kg) AS weight, COUNT(*) AS cnt " +
            "    FROM deposits GROUP BY user_id " +
            ") d ON d.user_id = t.user_id " +
            "WHERE t.user_id IS NULL " +
            "   OR (d.user_id IS NULL AND (t.total_points <> 0 OR t.total_weight_kg <> 0 OR t.deposit_count <> 0)) " +
            "   OR (d.user_id IS NOT NULL AND (t.total_points <> d.points " +
            "       OR t.total_weight_kg <> d.weight OR t.deposit_count <> d.cnt)) " +
            "ORDER BY 1",
            (rs, rowNum) -> rs.getObject("user_id", UUID.class)
        );
    }

    private RowMapper<UserTotals> totalsRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            Timestamp rebuiltAt = rs.getTimestamp("rebuilt_at");
            return UserTotals.of(
                rs.getObject("user_id", UUID.class),
                rs.getBigDecimal("total_points"),
                rs.getBigDecimal("total_weight_kg"),
                rs.getLong("deposit_count"),
                updatedAt != null ? updatedAt.toInstant() : null,
                rebuiltAt != null ? rebuiltAt.toInstant() : null
            );
        };
    }
}
