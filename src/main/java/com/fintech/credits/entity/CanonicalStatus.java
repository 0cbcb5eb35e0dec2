package com.fintech.credits.entity;

/**
 * Provider-independent outcome vocabulary. All dispatch switches on these values,
 * never on provider-specific status strings.
 */
public enum CanonicalStatus {
    COMPLETED,
    CANCELED,
    REFUNDED,
    FAILED
}
