package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Durable record of an inbound provider notification.
 * <p>
 * (provider, event_id) is unique: a redelivered notification never creates a second row.
 * The row is the unit of the retry state machine; see {@link WebhookProcessingStatus}.
 */
@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_status_next_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_webhook_received_at", columnList = "received_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_webhook_provider_event", columnNames = {"provider", "event_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    public static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String provider;

    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "canonical_status", length = 20)
    private CanonicalStatus canonicalStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private WebhookProcessingStatus status = WebhookProcessingStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(nullable = false, columnDefinition = "text")
    private String payload;

    @Column(name = "received_at", nullable = false, updatable = false)
    private LocalDateTime receivedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = receivedAt;
        }
    }
}
