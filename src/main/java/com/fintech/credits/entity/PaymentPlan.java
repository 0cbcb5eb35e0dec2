package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Catalog entry mapping a provider price/product to the credits granted per billing cycle.
 * Synchronized from the providers by an external job; read-only here.
 */
@Entity
@Table(name = "payment_plans", indexes = {
        @Index(name = "idx_plan_product", columnList = "provider_product_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_plan_price", columnNames = "provider_price_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_price_id", nullable = false, length = 100)
    private String providerPriceId;

    @Column(name = "provider_product_id", nullable = false, length = 100)
    private String providerProductId;

    @Column(name = "pg_provider", length = 20)
    private String pgProvider;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "credits_per_cycle", nullable = false)
    private Integer creditsPerCycle;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
