package com.flagship.donation_pipeline.pending;

import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.donation.DonationTypeConverter;
import com.flagship.donation_pipeline.support.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for the pending_paypal_donations staging table.
 *
 * No setters: rows change only through {@link #updateFromDomain(PendingDonation)},
 * which copies the fields a lifecycle transition is allowed to touch.
 */
@Entity
@Table(
    name = "pending_paypal_donations",
    indexes = {
        @Index(name = "idx_pending_paypal_order_id", columnList = "paypal_order_id"),
        @Index(name = "idx_pending_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PendingDonationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "paypal_order_id", length = 50)
    private String paypalOrderId;

    @Column(name = "donor_name", nullable = false, updatable = false)
    private String donorName;

    @Column(name = "donor_email", updatable = false)
    private String donorEmail;

    @Column(name = "donor_phone", length = 20, updatable = false)
    private String donorPhone;

    @Column(nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "campaign_name", updatable = false)
    private String campaignName;

    @Convert(converter = DonationTypeConverter.class)
    @Column(name = "donation_type", nullable = false, length = 30, updatable = false)
    private DonationType donationType;

    @Column(length = 500, updatable = false)
    private String message;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 4000, updatable = false)
    private Map<String, Object> metadata;

    @Convert(converter = PendingDonationStatusConverter.class)
    @Column(nullable = false, length = 20)
    private PendingDonationStatus status;

    @Column(name = "completed_donation_id")
    private UUID completedDonationId;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PendingDonationEntity fromDomain(PendingDonation pending) {
        if (pending.getStatus() == PendingDonationStatus.EXPIRED) {
            throw new IllegalArgumentException("EXPIRED is a computed status and cannot be stored");
        }
        return new PendingDonationEntity(
            pending.getId(),
            pending.getProviderOrderId(),
            pending.getDonorName(),
            pending.getDonorEmail(),
            pending.getDonorPhone(),
            pending.getAmount(),
            pending.getCurrency(),
            pending.getCampaignName(),
            pending.getDonationType(),
            pending.getMessage(),
            pending.getMetadata(),
            pending.getStatus(),
            pending.getCompletedDonationId(),
            pending.getExpiresAt(),
            pending.getCreatedAt(),
            null
        );
    }

    public PendingDonation toDomain() {
        return new PendingDonation(
            id,
            paypalOrderId,
            donorName,
            donorEmail,
            donorPhone,
            amount,
            currency,
            campaignName,
            donationType,
            message,
            metadata,
            status,
            completedDonationId,
            expiresAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the transition-owned fields: order link, status and completed donation.
     */
    void updateFromDomain(PendingDonation pending) {
        this.paypalOrderId = pending.getProviderOrderId();
        this.status = pending.getStatus();
        this.completedDonationId = pending.getCompletedDonationId();
    }
}
