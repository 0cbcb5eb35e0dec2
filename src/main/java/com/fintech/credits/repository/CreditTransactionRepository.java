package com.fintech.credits.repository;

import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.CreditTransactionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to the credit ledger: no update or delete queries.
 */
@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, Long> {

    /**
     * Allocation replay lookup.
     */
    Optional<CreditTransaction> findByReferenceId(String referenceId);

    /**
     * Usage replay lookup.
     */
    Optional<CreditTransaction> findByIdempotencyKey(UUID idempotencyKey);

    /**
     * Transaction history, most recent first. Provider and type filters are optional (null = any).
     * Offset/limit are applied through {@link OffsetPageRequest}.
     */
    @Query("SELECT t FROM CreditTransaction t WHERE t.subjectId = :subjectId " +
            "AND (:provider IS NULL OR t.provider = :provider) " +
            "AND (:type IS NULL OR t.type = :type) " +
            "ORDER BY t.createdAt DESC, t.id DESC")
    List<CreditTransaction> findHistory(
            @Param("subjectId") UUID subjectId,
            @Param("provider") String provider,
            @Param("type") CreditTransactionType type,
            Pageable pageable
    );

    @Query("SELECT COUNT(t) FROM CreditTransaction t WHERE t.subjectId = :subjectId " +
            "AND (:provider IS NULL OR t.provider = :provider) " +
            "AND (:type IS NULL OR t.type = :type)")
    long countHistory(
            @Param("subjectId") UUID subjectId,
            @Param("provider") String provider,
            @Param("type") CreditTransactionType type
    );

    /**
     * Running sum of all entries for one (subject, provider). Used by the consistency check.
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t " +
            "WHERE t.subjectId = :subjectId AND t.provider = :provider")
    BigDecimal sumAmount(@Param("subjectId") UUID subjectId, @Param("provider") String provider);

    long countBySubjectIdAndProvider(UUID subjectId, String provider);

    /**
     * Latest entry for one (subject, provider), used to cross-check {@code balanceAfter}.
     */
    Optional<CreditTransaction> findFirstBySubjectIdAndProviderOrderByCreatedAtDescIdDesc(
            UUID subjectId, String provider);
}
