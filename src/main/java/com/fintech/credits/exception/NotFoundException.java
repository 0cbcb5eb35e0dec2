package com.fintech.credits.exception;

/**
 * A required row (balance, subscription, webhook event, plan) does not exist.
 */
public class NotFoundException extends LedgerException {

    private final String resource;
    private final String key;

    public NotFoundException(String resource, String key) {
        super(String.format("%s not found: %s", resource, key));
        this.resource = resource;
        this.key = key;
    }

    public String getResource() {
        return resource;
    }

    public String getKey() {
        return key;
    }
}
