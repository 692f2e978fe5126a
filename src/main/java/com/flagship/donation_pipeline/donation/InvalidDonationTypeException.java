package com.flagship.donation_pipeline.donation;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a donation type outside {@link DonationType} reaches the
 * recording path. Indicates a defect upstream, never coerced to a default.
 */
@Getter
public class InvalidDonationTypeException extends IllegalStateException {

    private final String rejectedValue;
    private final List<String> allowedTypes;

    public InvalidDonationTypeException(String rejectedValue, List<String> allowedTypes) {
        super("Invalid donation type: " + rejectedValue);
        this.rejectedValue = rejectedValue;
        this.allowedTypes = allowedTypes;
    }
}
