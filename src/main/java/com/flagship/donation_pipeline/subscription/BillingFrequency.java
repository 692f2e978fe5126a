package com.flagship.donation_pipeline.subscription;

import java.util.Locale;

/**
 * Donor-facing frequency and the PayPal billing cycle it maps to.
 */
public enum BillingFrequency {
    WEEKLY("weekly", "WEEK", 1),
    MONTHLY("monthly", "MONTH", 1),
    QUARTERLY("quarterly", "MONTH", 3),
    YEARLY("yearly", "YEAR", 1);

    private final String value;
    private final String intervalUnit;
    private final int intervalCount;

    BillingFrequency(String value, String intervalUnit, int intervalCount) {
        this.value = value;
        this.intervalUnit = intervalUnit;
        this.intervalCount = intervalCount;
    }

    public String getValue() {
        return value;
    }

    public String getIntervalUnit() {
        return intervalUnit;
    }

    public int getIntervalCount() {
        return intervalCount;
    }

    /**
     * Unrecognized or missing frequencies bill monthly.
     */
    public static BillingFrequency fromValue(String value) {
        if (value == null) {
            return MONTHLY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BillingFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        return MONTHLY;
    }
}
