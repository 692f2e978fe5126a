package com.flagship.donation_pipeline.exception;

public class DonationNotFoundException extends RuntimeException {

    public DonationNotFoundException(String message) {
        super(message);
    }
}
