package com.fintech.credits.entity;

/**
 * Processing state of a stored webhook event.
 * <p>
 * PENDING -> COMPLETED | FAILED; FAILED is picked up again once {@code next_retry_at}
 * has elapsed. PROCESSING marks a row claimed by the retry sweeper.
 */
public enum WebhookProcessingStatus {
    /**
     * Durably received, not yet applied.
     */
    PENDING,

    /**
     * Claimed by a retry sweeper instance.
     */
    PROCESSING,

    /**
     * Fully applied. Terminal.
     */
    COMPLETED,

    /**
     * Last attempt raised an error; due again at {@code next_retry_at}.
     */
    FAILED
}
