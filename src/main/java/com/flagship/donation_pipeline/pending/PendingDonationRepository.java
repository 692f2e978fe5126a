package com.flagship.donation_pipeline.pending;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingDonationRepository extends JpaRepository<PendingDonationEntity, UUID> {

    Optional<PendingDonationEntity> findFirstByPaypalOrderIdOrderByCreatedAtDesc(String paypalOrderId);
}
