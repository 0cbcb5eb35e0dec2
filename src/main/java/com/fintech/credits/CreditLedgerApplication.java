package com.fintech.credits;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Credit Ledger Service
 * <p>
 * Turns asynchronous, at-least-once payment provider notifications (Stripe, Toss) into
 * exactly-once, auditable mutations of per-subject credit balances.
 * <p>
 * Key Features:
 * - Append-only credit ledger with a row-locked balance cache
 * - Durable webhook event store with exponential backoff retries
 * - Provider event normalization into one canonical status vocabulary
 * - Subscription cancellation that drains the funded balance to zero
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class CreditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditLedgerApplication.class, args);
    }
}
