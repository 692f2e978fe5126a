package com.flagship.donation_pipeline.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class PaymentAlreadyProcessedException extends RuntimeException {

    private final String orderId;
    private final UUID donationId;

    public PaymentAlreadyProcessedException(String orderId, UUID donationId) {
        super("This payment has already been processed");
        this.orderId = orderId;
        this.donationId = donationId;
    }
}
