package com.flagship.recycling_ledger.deposit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and append access to the deposit ledger.
 * There is deliberately no update or delete query here.
 */
@Repository
public interface DepositRepository extends JpaRepository<DepositEntity, UUID> {

    Optional<DepositEntity> findByTransactionId(String transactionId);

    long countByUserId(UUID userId);

    /**
     * Accepted deposits of a user in the half-open interval [from, to).
     * Backs the daily limit.
     */
    @Query("""
        SELECT COUNT(d) FROM DepositEntity d
        WHERE d.userId = :userId AND d.createdAt >= :from AND d.createdAt < :to
        """)
    long countForUserBetween(@Param("userId") UUID userId,
                             @Param("from") Instant from,
                             @Param("to") Instant to);

    /**
     * Accepted deposits of a user at or after {@code since}.
     * Backs the velocity limit.
     */
    @Query("""
        SELECT COUNT(d) FROM DepositEntity d
        WHERE d.userId = :userId AND d.createdAt >= :since
        """)
    long countForUserSince(@Param("userId") UUID userId, @Param("since") Instant since);

    /**
     * Deposit history page. {@code materialPattern} is a lower-case LIKE pattern
     * ("%" matches everything); the time bounds are half-open.
     */
    @Query("""
        SELECT d FROM DepositEntity d
        WHERE d.userId = :userId
          AND LOWER(d.materialName) LIKE :materialPattern
          AND d.createdAt >= :from AND d.createdAt < :to
        """)
    Page<DepositEntity> findHistory(@Param("userId") UUID userId,
                                    @Param("materialPattern") String materialPattern,
                                    @Param("from") Instant from,
                                    @Param("to") Instant to,
                                    Pageable pageable);

    List<DepositEntity> findTop5ByUserIdOrderByCreatedAtDescSequenceNumberDesc(UUID userId);
}
