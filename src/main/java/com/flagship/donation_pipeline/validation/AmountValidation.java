package com.flagship.donation_pipeline.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of validating a donation amount.
 */
@Value
public class AmountValidation {
    boolean valid;
    BigDecimal value;
    String error;

    static AmountValidation accepted(BigDecimal value) {
        return new AmountValidation(true, value, null);
    }

    static AmountValidation rejected(String error) {
        return new AmountValidation(false, BigDecimal.ZERO.setScale(2), error);
    }
}
