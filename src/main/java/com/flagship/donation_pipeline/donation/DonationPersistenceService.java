package com.flagship.donation_pipeline.donation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Donation} domain object and {@link DonationEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DonationPersistenceService {

    private final DonationRepository donationRepository;

    /**
     * Inserts a new donation and flushes, so a duplicate transaction id fails
     * inside this call with a {@code DataIntegrityViolationException}.
     */
    @Transactional
    public Donation insert(Donation donation) {
        DonationEntity saved = donationRepository.saveAndFlush(DonationEntity.fromDomain(donation));
        log.debug("Inserted donation {} for transaction {}", saved.getId(), saved.getTransactionId());
        return saved.toDomain();
    }

    @Transactional
    public Donation update(Donation donation) {
        DonationEntity existing = donationRepository.findById(donation.getId())
            .orElseThrow(() -> new IllegalArgumentException("Donation not found: " + donation.getId()));
        existing.updateFromDomain(donation);
        DonationEntity updated = donationRepository.save(existing);
        log.debug("Updated donation {}", updated.getId());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Donation> findById(UUID donationId) {
        return donationRepository.findById(donationId).map(DonationEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Donation> findByTransactionId(String transactionId) {
        return donationRepository.findByTransactionId(transactionId).map(DonationEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Donation> findByProviderOrderId(String orderId) {
        return donationRepository.findFirstByProviderOrderIdOrderByCreatedAtAsc(orderId).map(DonationEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Donation> findBySubscriptionId(String subscriptionId) {
        return donationRepository.findBySubscriptionId(subscriptionId).stream()
            .map(DonationEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Donation> findSubscriptionRow(String subscriptionId) {
        return donationRepository.findFirstBySubscriptionIdAndTransactionIdIsNullOrderByCreatedAtAsc(subscriptionId)
            .map(DonationEntity::toDomain);
    }

    /**
     * Sets the status of every donation correlated with the subscription.
     *
     * @return number of rows changed
     */
    @Transactional
    public int updateSubscriptionStatus(String subscriptionId, DonationStatus status, String providerStatus) {
        List<DonationEntity> rows = donationRepository.findBySubscriptionId(subscriptionId);
        for (DonationEntity row : rows) {
            row.updateFromDomain(row.toDomain().withSubscriptionStatus(status, providerStatus));
        }
        donationRepository.saveAll(rows);
        return rows.size();
    }
}
