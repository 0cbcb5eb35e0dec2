package com.fintech.credits.exception;

/**
 * Thrown when a webhook delivery cannot be verified or parsed.
 * Such deliveries are rejected synchronously and never enter the retry cycle.
 */
public class ProviderVerificationException extends LedgerException {

    private final String providerName;

    public ProviderVerificationException(String message, String providerName) {
        super(message);
        this.providerName = providerName;
    }

    public ProviderVerificationException(String message, String providerName, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
