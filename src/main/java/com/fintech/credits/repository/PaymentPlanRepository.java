package com.fintech.credits.repository;

import com.fintech.credits.entity.PaymentPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentPlanRepository extends JpaRepository<PaymentPlan, Long> {

    Optional<PaymentPlan> findByProviderPriceId(String providerPriceId);

    /**
     * Several prices may share a product; the active one wins, then the most recently created.
     */
    Optional<PaymentPlan> findFirstByProviderProductIdOrderByActiveDescCreatedAtDesc(String providerProductId);
}
