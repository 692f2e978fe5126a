package com.flagship.donation_pipeline.donation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DonationRepository extends JpaRepository<DonationEntity, UUID> {

    Optional<DonationEntity> findByTransactionId(String transactionId);

    Optional<DonationEntity> findFirstByProviderOrderIdOrderByCreatedAtAsc(String providerOrderId);

    List<DonationEntity> findBySubscriptionId(String subscriptionId);

    /**
     * The subscription's own row, as opposed to the per-charge rows that carry a sale id.
     */
    Optional<DonationEntity> findFirstBySubscriptionIdAndTransactionIdIsNullOrderByCreatedAtAsc(String subscriptionId);
}
