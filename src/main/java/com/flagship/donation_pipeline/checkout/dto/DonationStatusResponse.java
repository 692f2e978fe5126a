package com.flagship.donation_pipeline.checkout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationStatus;
import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.pending.PendingDonation;
import com.flagship.donation_pipeline.pending.PendingDonationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Polled by the donation page after the PayPal redirect.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DonationStatusResponse {
    @Builder.Default
    boolean success = true;
    UUID pendingId;
    PendingDonationStatus status;
    String orderId;
    BigDecimal amount;
    String currency;
    DonationType donationType;
    String campaignName;
    Instant createdAt;
    Instant expiresAt;
    CompletedDonation donation;

    @Value
    public static class CompletedDonation {
        UUID id;
        String receiptNumber;
        String transactionId;
        DonationStatus status;
    }

    public static DonationStatusResponse of(PendingDonation pending, PendingDonationStatus effectiveStatus,
                                            Donation donation) {
        return DonationStatusResponse.builder()
                .pendingId(pending.getId())
                .status(effectiveStatus)
                .orderId(pending.getProviderOrderId())
                .amount(pending.getAmount())
                .currency(pending.getCurrency())
                .donationType(pending.getDonationType())
                .campaignName(pending.getCampaignName())
                .createdAt(pending.getCreatedAt())
                .expiresAt(pending.getExpiresAt())
                .donation(donation == null ? null : new CompletedDonation(
                        donation.getId(), donation.getReceiptNumber(), donation.getTransactionId(), donation.getStatus()))
                .build();
    }
}
