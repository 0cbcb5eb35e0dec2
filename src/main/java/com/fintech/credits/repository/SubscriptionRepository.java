package com.fintech.credits.repository;

import com.fintech.credits.entity.Subscription;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByProviderSubscriptionId(String providerSubscriptionId);

    /**
     * Locked lookup used by cancellation so that concurrent cancel deliveries serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.providerSubscriptionId = :providerSubscriptionId")
    Optional<Subscription> findByProviderSubscriptionIdForUpdate(
            @Param("providerSubscriptionId") String providerSubscriptionId
    );

    List<Subscription> findBySubjectId(UUID subjectId);
}
