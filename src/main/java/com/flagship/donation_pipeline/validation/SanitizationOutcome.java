package com.flagship.donation_pipeline.validation;

import lombok.Value;

import java.util.List;

@Value
public class SanitizationOutcome {
    List<String> errors;
    SanitizedDonation sanitized;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
