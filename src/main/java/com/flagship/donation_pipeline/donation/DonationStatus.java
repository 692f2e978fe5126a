package com.flagship.donation_pipeline.donation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Payment status of a recorded donation ({@code payment_status} column).
 */
public enum DonationStatus {
    COMPLETED,
    PENDING,
    CANCELLED,
    SUSPENDED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a provider subscription status (ACTIVE, CANCELLED, SUSPENDED, ...)
     * to the status of the correlated donation rows.
     */
    public static DonationStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public static DonationStatus fromSubscriptionStatus(String providerStatus) {
        if (providerStatus == null) {
            return PENDING;
        }
        return switch (providerStatus.toUpperCase(Locale.ROOT)) {
            case "ACTIVE" -> COMPLETED;
            case "CANCELLED" -> CANCELLED;
            case "SUSPENDED" -> SUSPENDED;
            default -> PENDING;
        };
    }
}
