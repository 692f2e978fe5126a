package com.flagship.donation_pipeline.checkout.dto;

import com.flagship.donation_pipeline.capture.CaptureOutcome;
import com.flagship.donation_pipeline.capture.CaptureResult;
import com.flagship.donation_pipeline.donation.Donation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CaptureResponse {
    @Builder.Default
    boolean success = true;
    String message;
    CaptureData data;

    @Value
    @Builder
    public static class CaptureData {
        UUID donationId;
        String transactionId;
        String orderId;
        String receiptNumber;
        String status;
        Payment payment;
        Payer payer;
        Instant capturedAt;
        boolean alreadyRecorded;
    }

    @Value
    public static class Payment {
        BigDecimal grossAmount;
        BigDecimal paypalFee;
        BigDecimal netAmount;
        String currency;
    }

    @Value
    public static class Payer {
        String payerId;
        String email;
        String name;
    }

    public static CaptureResponse from(CaptureOutcome outcome) {
        CaptureResult capture = outcome.getCapture();
        Donation donation = outcome.getDonation();
        return CaptureResponse.builder()
                .message(outcome.isNewlyRecorded()
                        ? "Payment captured successfully"
                        : "Payment was already recorded")
                .data(CaptureData.builder()
                        .donationId(donation.getId())
                        .transactionId(capture.getTransactionId())
                        .orderId(capture.getOrderId())
                        .receiptNumber(capture.getReceiptNumber())
                        .status(capture.getStatus())
                        .payment(new Payment(capture.getGrossAmount(), capture.getPaypalFee(),
                                capture.getNetAmount(), capture.getCurrency()))
                        .payer(new Payer(capture.getPayerId(), capture.getPayerEmail(), capture.getPayerName()))
                        .capturedAt(capture.getCapturedAt())
                        .alreadyRecorded(!outcome.isNewlyRecorded())
                        .build())
                .build();
    }
}
