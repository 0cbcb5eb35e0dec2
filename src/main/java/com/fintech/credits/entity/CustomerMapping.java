package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Links a provider-side customer id (e.g. a Stripe {@code cus_...}) to the internal subject.
 */
@Entity
@Table(name = "customer_mappings", indexes = {
        @Index(name = "idx_customer_mapping_subject", columnList = "provider, subject_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_customer_mapping_provider_customer",
                columnNames = {"provider", "provider_customer_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String provider;

    @Column(name = "provider_customer_id", nullable = false, length = 100)
    private String providerCustomerId;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(length = 255)
    private String email;

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
