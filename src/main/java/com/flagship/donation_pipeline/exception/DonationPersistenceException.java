package com.flagship.donation_pipeline.exception;

/**
 * A datastore write the pipeline depends on failed.
 */
public class DonationPersistenceException extends RuntimeException {

    public DonationPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
