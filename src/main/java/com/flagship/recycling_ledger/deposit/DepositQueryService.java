package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.deposit.guard.GuardPolicy;
import com.flagship.recycling_ledger.totals.AggregateProjector;
import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Read side of the deposit ledger: history pages and the user summary.
 */
@Service
@RequiredArgsConstructor
public class DepositQueryService {

    public static final int HISTORY_PAGE_SIZE = 20;
    static final Duration RECENT_PERIOD = Duration.ofDays(30);

    // Open-ended bounds keep the history query free of nullable parameters
    private static final Instant NO_LOWER_BOUND = Instant.EPOCH;
    private static final Instant NO_UPPER_BOUND = Instant.parse("9999-12-31T00:00:00Z");

    private final DepositRepository depositRepository;
    private final AggregateProjector aggregateProjector;
    private final JdbcTemplate jdbcTemplate;
    private final GuardPolicy guardPolicy;
    private final Clock clock;

    /**
     * One page of a user's deposits, newest first.
     *
     * @param page zero-based page index
     * @param material optional material name, matched case-insensitively
     * @param dateFrom optional first day, inclusive
     * @param dateTo optional last day, inclusive
     */
    @Transactional(readOnly = true)
    public Page<Deposit> history(UUID userId, int page, String material, LocalDate dateFrom, LocalDate dateTo) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must not be negative");
        }
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }

        ZoneId zone = guardPolicy.getZone();
        Instant from = dateFrom != null ? dateFrom.atStartOfDay(zone).toInstant() : NO_LOWER_BOUND;
        Instant to = dateTo != null ? dateTo.plusDays(1).atStartOfDay(zone).toInstant() : NO_UPPER_BOUND;

        PageRequest pageRequest = PageRequest.of(page, HISTORY_PAGE_SIZE,
            Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "sequenceNumber")));

        return depositRepository.findHistory(userId, materialPattern(material), from, to, pageRequest)
            .map(DepositEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public UserSummary summary(UUID userId) {
        UserTotals totals = aggregateProjector.getTotals(userId);
        UserSummary.PeriodStats recent = periodStats(userId, clock.instant().minus(RECENT_PERIOD));
        List<UserSummary.MaterialBreakdown> breakdown = materialBreakdown(userId);
        String favorite = breakdown.isEmpty() ? null : breakdown.get(0).getMaterialName();

        List<Deposit> recentDeposits = depositRepository
            .findTop5ByUserIdOrderByCreatedAtDescSequenceNumberDesc(userId).stream()
            .map(DepositEntity::toDomain)
            .toList();

        return new UserSummary(totals, recent, breakdown, favorite, recentDeposits, rank(userId));
    }

    private UserSummary.PeriodStats periodStats(UUID userId, Instant since) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(points_earned), 0) AS points, " +
            "       COALESCE(SUM(weight_kg), 0) AS weight, " +
            "       COUNT(*) AS cnt " +
            "FROM deposits WHERE user_id = ? AND created_at >= ?",
            (rs, rowNum) -> new UserSummary.PeriodStats(
                rs.getBigDecimal("points").setScale(UserTotals.POINTS_SCALE),
                rs.getBigDecimal("weight").setScale(UserTotals.WEIGHT_SCALE),
                rs.getLong("cnt")),
            userId, Timestamp.from(since)
        );
    }

    private List<UserSummary.MaterialBreakdown> materialBreakdown(UUID userId) {
        return jdbcTemplate.query(
            "SELECT material_name, SUM(weight_kg) AS weight, SUM(points_earned) AS points, COUNT(*) AS cnt " +
            "FROM deposits WHERE user_id = ? " +
            "GROUP BY material_name " +
            "ORDER BY weight DESC, material_name ASC",
            (rs, rowNum) -> new UserSummary.MaterialBreakdown(
                rs.getString("material_name"),
                rs.getBigDecimal("weight"),
                rs.getBigDecimal("points"),
                rs.getLong("cnt")),
            userId
        );
    }

    /**
     * Leaderboard position: 1 + the number of users with strictly more points.
     */
    private long rank(UUID userId) {
        Long higher = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM user_totals " +
            "WHERE total_points > COALESCE((SELECT total_points FROM user_totals WHERE user_id = ?), 0)",
            Long.class,
            userId
        );
        return 1 + (higher != null ? higher : 0);
    }

    private static String materialPattern(String material) {
        if (material == null || material.isBlank()) {
            return "%";
        }
        return material.strip().toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }
}
