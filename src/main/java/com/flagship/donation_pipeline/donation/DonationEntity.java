package com.flagship.donation_pipeline.donation;

import com.flagship.donation_pipeline.support.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for the donations table.
 *
 * The UNIQUE constraint on transaction_id is the storage-level guarantee that a
 * PayPal transaction is recorded at most once. Subscription rows carry no
 * transaction id, and NULLs do not collide.
 */
@Entity
@Table(
    name = "donations",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_donations_transaction_id", columnNames = "transaction_id")
    },
    indexes = {
        @Index(name = "idx_donations_subscription_id", columnList = "subscription_id"),
        @Index(name = "idx_donations_paypal_order_id", columnList = "paypal_order_id"),
        @Index(name = "idx_donations_payment_status", columnList = "payment_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DonationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "donor_name", nullable = false)
    private String donorName;

    @Column(name = "donor_email")
    private String donorEmail;

    @Column(name = "donor_phone", length = 20)
    private String donorPhone;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Convert(converter = DonationTypeConverter.class)
    @Column(name = "donation_type", nullable = false, length = 30, updatable = false)
    private DonationType donationType;

    @Convert(converter = DonationStatusConverter.class)
    @Column(name = "payment_status", nullable = false, length = 20)
    private DonationStatus status;

    @Column(name = "payment_method", nullable = false, length = 20, updatable = false)
    private String paymentMethod;

    @Column(name = "payment_provider", nullable = false, length = 20, updatable = false)
    private String paymentProvider;

    @Column(length = 200)
    private String purpose;

    @Column(length = 500)
    private String message;

    @Column(name = "transaction_id", length = 50, updatable = false)
    private String transactionId;

    @Column(name = "subscription_id", length = 50, updatable = false)
    private String subscriptionId;

    @Column(name = "paypal_order_id", length = 50, updatable = false)
    private String providerOrderId;

    @Column(name = "receipt_number", length = 50, updatable = false)
    private String receiptNumber;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 4000)
    private Map<String, Object> metadata;

    @Column(name = "donation_date", nullable = false)
    private LocalDate donationDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static DonationEntity fromDomain(Donation donation) {
        return new DonationEntity(
            donation.getId(),
            donation.getDonorName(),
            donation.getDonorEmail(),
            donation.getDonorPhone(),
            donation.getAmount(),
            donation.getCurrency(),
            donation.getDonationType(),
            donation.getStatus(),
            donation.getPaymentMethod(),
            donation.getPaymentProvider(),
            donation.getPurpose(),
            donation.getMessage(),
            donation.getTransactionId(),
            donation.getSubscriptionId(),
            donation.getProviderOrderId(),
            donation.getReceiptNumber(),
            donation.getMetadata(),
            donation.getDonationDate(),
            null,
            null
        );
    }

    public Donation toDomain() {
        return Donation.builder()
            .id(id)
            .donorName(donorName)
            .donorEmail(donorEmail)
            .donorPhone(donorPhone)
            .amount(amount)
            .currency(currency)
            .donationType(donationType)
            .status(status)
            .paymentMethod(paymentMethod)
            .paymentProvider(paymentProvider)
            .purpose(purpose)
            .message(message)
            .transactionId(transactionId)
            .subscriptionId(subscriptionId)
            .providerOrderId(providerOrderId)
            .receiptNumber(receiptNumber)
            .metadata(metadata)
            .donationDate(donationDate)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the fields a subscription re-activation or status change may touch.
     * Identity, type and correlation keys never change.
     */
    void updateFromDomain(Donation donation) {
        this.donorName = donation.getDonorName();
        this.donorEmail = donation.getDonorEmail();
        this.donorPhone = donation.getDonorPhone();
        this.amount = donation.getAmount();
        this.currency = donation.getCurrency();
        this.status = donation.getStatus();
        this.purpose = donation.getPurpose();
        this.message = donation.getMessage();
        this.metadata = donation.getMetadata();
        this.donationDate = donation.getDonationDate();
    }
}
