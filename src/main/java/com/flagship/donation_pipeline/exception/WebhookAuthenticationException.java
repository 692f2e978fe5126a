package com.flagship.donation_pipeline.exception;

public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
