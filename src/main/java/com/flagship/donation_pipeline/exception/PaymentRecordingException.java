package com.flagship.donation_pipeline.exception;

import lombok.Getter;

/**
 * PayPal captured the money but the donation could not be recorded locally.
 *
 * This is a financial discrepancy that needs manual reconciliation. The order
 * is already consumed at PayPal, so a client retry of the capture will not
 * help; the transaction id identifies the payment to reconcile.
 */
@Getter
public class PaymentRecordingException extends RuntimeException {

    private final String transactionId;
    private final String orderId;

    public PaymentRecordingException(String transactionId, String orderId, Throwable cause) {
        super("Payment was captured but failed to save donation record. Please contact support.", cause);
        this.transactionId = transactionId;
        this.orderId = orderId;
    }
}
