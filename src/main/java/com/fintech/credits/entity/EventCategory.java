package com.fintech.credits.entity;

/**
 * What a normalized provider event is about. Dispatch pairs this with the
 * {@link CanonicalStatus} to pick a handler.
 */
public enum EventCategory {
    /**
     * A one-off or recurring charge (Stripe invoice/charge, Toss payment).
     */
    PAYMENT,

    /**
     * Subscription lifecycle change.
     */
    SUBSCRIPTION,

    /**
     * Payment method / customer setup completed.
     */
    CUSTOMER_SETUP,

    OTHER
}
