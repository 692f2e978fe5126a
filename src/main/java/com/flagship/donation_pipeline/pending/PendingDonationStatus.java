package com.flagship.donation_pipeline.pending;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a pending donation. Linear, no backward transitions:
 * PENDING → PROCESSING → COMPLETED | FAILED (PENDING → FAILED also allowed).
 *
 * EXPIRED is never stored; it is reported for non-terminal records past
 * their expiry time.
 */
public enum PendingDonationStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    EXPIRED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PendingDonationStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }
}
