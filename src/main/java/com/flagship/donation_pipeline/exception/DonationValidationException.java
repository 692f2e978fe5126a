package com.flagship.donation_pipeline.exception;

import lombok.Getter;

import java.util.List;

/**
 * Caller input rejected. The error list is safe to return to the client.
 */
@Getter
public class DonationValidationException extends RuntimeException {

    private final List<String> errors;

    public DonationValidationException(String message) {
        this(message, List.of());
    }

    public DonationValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }
}
