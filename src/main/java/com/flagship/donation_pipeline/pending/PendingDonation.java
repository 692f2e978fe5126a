package com.flagship.donation_pipeline.pending;

import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.validation.SanitizedDonation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A checkout the donor started but PayPal has not confirmed yet.
 *
 * Bridges the redirect to PayPal and the later capture or webhook. State changes
 * are immutable: each transition returns a new instance and rejects moves the
 * lifecycle does not allow.
 */
@Value
public class PendingDonation {
    UUID id;
    String providerOrderId;
    String donorName;
    String donorEmail;
    String donorPhone;
    BigDecimal amount;
    String currency;
    String campaignName;
    DonationType donationType;
    String message;
    Map<String, Object> metadata;
    PendingDonationStatus status;
    UUID completedDonationId;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new pending donation in PENDING status.
     */
    public static PendingDonation create(UUID id, SanitizedDonation donation, Instant now, Duration expiry) {
        return new PendingDonation(
                id,
                null,
                donation.getDonorName(),
                donation.getDonorEmail(),
                donation.getDonorPhone(),
                donation.getAmount(),
                donation.getCurrency(),
                donation.getCampaignName(),
                donation.getDonationType(),
                donation.getMessage(),
                donation.getMetadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(donation.getMetadata()),
                PendingDonationStatus.PENDING,
                null,
                now.plus(expiry),
                now,
                now
        );
    }

    /**
     * Links the PayPal order. Only valid from PENDING.
     */
    public PendingDonation attachOrder(String orderId) {
        if (status != PendingDonationStatus.PENDING) {
            throw new IllegalStateException(String.format(
                    "Cannot attach order to pending donation in %s status. Only PENDING donations can be linked.", status));
        }
        return transition(PendingDonationStatus.PROCESSING, orderId, null);
    }

    /**
     * Records the donation created for this checkout. Only valid from PROCESSING.
     */
    public PendingDonation complete(UUID donationId) {
        if (status != PendingDonationStatus.PROCESSING) {
            throw new IllegalStateException(String.format(
                    "Cannot complete pending donation in %s status. Only PROCESSING donations can be completed.", status));
        }
        return transition(PendingDonationStatus.COMPLETED, providerOrderId, donationId);
    }

    /**
     * Only valid from PENDING or PROCESSING.
     */
    public PendingDonation fail() {
        if (status != PendingDonationStatus.PENDING && status != PendingDonationStatus.PROCESSING) {
            throw new IllegalStateException(String.format(
                    "Cannot fail pending donation in %s status. Only PENDING or PROCESSING donations can be failed.", status));
        }
        return transition(PendingDonationStatus.FAILED, providerOrderId, null);
    }

    public boolean isExpired(Instant now) {
        return !status.isTerminal() && expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Status as reported to the donor: EXPIRED for stale unfinished checkouts.
     */
    public PendingDonationStatus effectiveStatus(Instant now) {
        return isExpired(now) ? PendingDonationStatus.EXPIRED : status;
    }

    private PendingDonation transition(PendingDonationStatus target, String orderId, UUID donationId) {
        return new PendingDonation(
                id,
                orderId,
                donorName,
                donorEmail,
                donorPhone,
                amount,
                currency,
                campaignName,
                donationType,
                message,
                metadata,
                target,
                donationId,
                expiresAt,
                createdAt,
                Instant.now()
        );
    }
}
