package com.fintech.credits.repository;

import com.fintech.credits.entity.UserCreditBalance;
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
public interface UserCreditBalanceRepository extends JpaRepository<UserCreditBalance, Long> {

    /**
     * Read-only lookup, no lock.
     */
    Optional<UserCreditBalance> findBySubjectIdAndProvider(UUID subjectId, String provider);

    /**
     * Find the balance row with a pessimistic write lock ({@code SELECT ... FOR UPDATE}).
     * Serializes all mutations of one (subject, provider); other pairs are unaffected.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM UserCreditBalance b WHERE b.subjectId = :subjectId AND b.provider = :provider")
    Optional<UserCreditBalance> findForUpdate(
            @Param("subjectId") UUID subjectId,
            @Param("provider") String provider
    );

    List<UserCreditBalance> findBySubjectId(UUID subjectId);
}
