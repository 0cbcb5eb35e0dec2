package com.fintech.credits.repository;

import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.entity.WebhookProcessingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for stored webhook events and their retry state.
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

    /**
     * Dedup lookup by the provider's own event id.
     */
    Optional<WebhookEvent> findByProviderAndEventId(String provider, String eventId);

    boolean existsByProviderAndEventId(String provider, String eventId);

    /**
     * Events due for (re)processing: status in the given set, next retry unset or elapsed and
     * fewer than {@code maxAttempts} failures, oldest received first.
     *
     * @param statuses    normally PENDING and FAILED
     * @param now         current time from the application clock
     * @param maxAttempts exclusive upper bound on retryCount
     * @param pageable    limit
     */
    @Query("SELECT e FROM WebhookEvent e WHERE e.status IN :statuses " +
            "AND (e.nextRetryAt IS NULL OR e.nextRetryAt <= :now) " +
            "AND e.retryCount < :maxAttempts " +
            "ORDER BY e.receivedAt ASC, e.id ASC")
    List<WebhookEvent> findDue(
            @Param("statuses") Collection<WebhookProcessingStatus> statuses,
            @Param("now") LocalDateTime now,
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable
    );

    /**
     * Conditional claim taken by ingestion and by the retry sweeper. Returns 1 only for the caller
     * that moved the row out of a claimable status, so no two workers process the same event.
     */
    @Modifying
    @Query("UPDATE WebhookEvent e SET e.status = :claimed, e.updatedAt = :now " +
            "WHERE e.id = :id AND e.status IN :claimable")
    int claim(
            @Param("id") Long id,
            @Param("claimable") Collection<WebhookProcessingStatus> claimable,
            @Param("claimed") WebhookProcessingStatus claimed,
            @Param("now") LocalDateTime now
    );

    /**
     * Return claims abandoned by a crashed sweeper to PENDING.
     */
    @Modifying
    @Query("UPDATE WebhookEvent e SET e.status = :pending, e.updatedAt = :now " +
            "WHERE e.status = :processing AND e.updatedAt < :claimedBefore")
    int releaseStaleClaims(
            @Param("processing") WebhookProcessingStatus processing,
            @Param("pending") WebhookProcessingStatus pending,
            @Param("claimedBefore") LocalDateTime claimedBefore,
            @Param("now") LocalDateTime now
    );

    /**
     * Count events by status for metrics/monitoring.
     */
    long countByStatus(WebhookProcessingStatus status);

    /**
     * Failed events that exhausted their attempts and need manual review.
     */
    long countByStatusAndRetryCountGreaterThanEqual(WebhookProcessingStatus status, int retryCount);
}
