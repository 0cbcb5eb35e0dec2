package com.fintech.credits.entity;

public enum SubscriptionStatus {
    ACTIVE,
    INACTIVE
}
