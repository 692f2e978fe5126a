package com.flagship.donation_pipeline.exception;

import lombok.Getter;

/**
 * PayPal rejected a request or could not be reached.
 *
 * Callers branch on {@link #getStatus()}, never on the message text.
 * The raw body is kept for operators and only exposed outside production.
 */
@Getter
public class PaymentProviderException extends RuntimeException {

    private final int status;
    private final String rawBody;

    public PaymentProviderException(String message, int status, String rawBody) {
        super(message);
        this.status = status;
        this.rawBody = rawBody;
    }

    public PaymentProviderException(String message, int status, String rawBody, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.rawBody = rawBody;
    }

    public boolean isServiceUnavailable() {
        return status == 503;
    }

    public boolean isCallerError() {
        return status >= 400 && status < 500;
    }
}
