package com.fintech.credits.service.provider;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.exception.ProviderVerificationException;

/**
 * Turns one provider's webhook deliveries into {@link NormalizedEvent}s.
 * Implementations must verify the delivery before looking at its contents.
 */
public interface PaymentProviderAdapter {

    /**
     * Get the provider name (e.g. "stripe", "toss"). Used as the registry key and as
     * the provider column of stored webhook events.
     */
    String getProviderName();

    /**
     * Verify the signature of a raw delivery, then parse it.
     *
     * @param payload   raw request body, exactly as received
     * @param signature provider signature header value
     * @throws ProviderVerificationException if the signature is missing or wrong, or the body is malformed
     */
    NormalizedEvent normalize(byte[] payload, String signature) throws ProviderVerificationException;

    /**
     * Parse a payload that was verified when it was first received (retry path).
     */
    NormalizedEvent parse(String trustedPayload) throws ProviderVerificationException;
}
