package com.flagship.donation_pipeline.capture;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A completed PayPal capture, as needed to record the donation.
 *
 * {@code netAmount} is always {@code grossAmount - paypalFee}, computed locally
 * to the cent.
 */
@Value
@Builder
public class CaptureResult {
    String transactionId;
    String orderId;
    String status;
    String receiptNumber;
    BigDecimal grossAmount;
    BigDecimal paypalFee;
    BigDecimal netAmount;
    String currency;
    String payerId;
    String payerEmail;
    String payerName;
    String purchaseDescription;
    Instant capturedAt;
    CorrelationBlob correlation;
}
