package com.fintech.credits.exception;

/**
 * Malformed input to a ledger operation (missing subject, non-positive amount, ...).
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
