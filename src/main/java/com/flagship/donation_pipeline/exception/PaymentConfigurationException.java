package com.flagship.donation_pipeline.exception;

public class PaymentConfigurationException extends RuntimeException {

    public PaymentConfigurationException(String message) {
        super(message);
    }
}
