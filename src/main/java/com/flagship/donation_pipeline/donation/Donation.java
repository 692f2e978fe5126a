package com.flagship.donation_pipeline.donation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A recorded donation: money PayPal confirmed, or a recurring subscription mirrored locally.
 *
 * Correlation keys (transaction id, subscription id, order id, receipt number) are
 * first-class fields so they can be indexed and constrained; the metadata map keeps
 * the full accounting breakdown under the same names.
 */
@Value
@Builder(toBuilder = true)
public class Donation {

    public static final String PAYMENT_METHOD_ONLINE = "online";
    public static final String PROVIDER_PAYPAL = "paypal";

    UUID id;
    String donorName;
    String donorEmail;
    String donorPhone;
    BigDecimal amount;
    String currency;
    DonationType donationType;
    DonationStatus status;
    String paymentMethod;
    String paymentProvider;
    String purpose;
    String message;

    /** PayPal capture or sale id. At most one donation exists per value. */
    String transactionId;
    String subscriptionId;
    String providerOrderId;
    String receiptNumber;

    Map<String, Object> metadata;
    LocalDate donationDate;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Applies a provider subscription status: the local status follows the
     * provider's, and the provider string is kept verbatim in metadata.
     */
    public Donation withSubscriptionStatus(DonationStatus newStatus, String providerStatus) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        updated.put("subscription_status", providerStatus);
        return toBuilder()
                .status(newStatus)
                .metadata(updated)
                .build();
    }
}
