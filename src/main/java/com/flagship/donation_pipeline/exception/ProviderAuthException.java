package com.flagship.donation_pipeline.exception;

/**
 * The OAuth token request to PayPal failed. Fatal for the current operation.
 */
public class ProviderAuthException extends PaymentProviderException {

    public ProviderAuthException(String rawBody) {
        super("PayPal authentication failed", 503, rawBody);
    }

    public ProviderAuthException(Throwable cause) {
        super("PayPal authentication failed", 503, null, cause);
    }
}
