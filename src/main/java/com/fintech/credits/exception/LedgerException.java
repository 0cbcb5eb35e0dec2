package com.fintech.credits.exception;

/**
 * Base exception for credit ledger and webhook reconciliation errors.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
