package com.flagship.donation_pipeline.pending;

import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.exception.DonationNotFoundException;
import com.flagship.donation_pipeline.exception.DonationPersistenceException;
import com.flagship.donation_pipeline.support.BestEffortResult;
import com.flagship.donation_pipeline.validation.SanitizedDonation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable staging area between "donor started checkout" and "PayPal confirmed payment".
 *
 * Failure policy:
 * - {@link #create} and {@link #attachOrder} must succeed, failures are thrown
 * - lookups treat "not found" as a normal outcome
 * - terminal bookkeeping ({@link #markCompleted}, {@link #markFailed}) is best-effort
 *   and reported through {@link BestEffortResult}
 */
@Service
@Slf4j
public class PendingDonationStore {

    private final PendingDonationRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final DonationProperties donationProperties;
    private final Clock clock;

    public PendingDonationStore(PendingDonationRepository repository,
                                TransactionTemplate transactionTemplate,
                                DonationProperties donationProperties,
                                Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.donationProperties = donationProperties;
        this.clock = clock;
    }

    /**
     * Inserts a new pending donation.
     *
     * @return the generated pending id
     * @throws DonationPersistenceException when the row cannot be written
     */
    public UUID create(SanitizedDonation donation) {
        PendingDonation pending = PendingDonation.create(
                UUID.randomUUID(), donation, clock.instant(), donationProperties.getPendingExpiry());
        try {
            repository.save(PendingDonationEntity.fromDomain(pending));
        } catch (DataAccessException e) {
            log.error("Failed to create pending donation: amount={}, type={}, error={}",
                    donation.getAmount(), donation.getDonationType(), e.getMessage());
            throw new DonationPersistenceException("Failed to initialize payment", e);
        }
        log.info("Pending donation created: pendingId={}, amount={}, currency={}, type={}",
                pending.getId(), pending.getAmount(), pending.getCurrency(), pending.getDonationType().getValue());
        return pending.getId();
    }

    /**
     * Links the PayPal order to the pending donation (pending → processing).
     *
     * @throws DonationPersistenceException when the link cannot be written
     */
    public void attachOrder(UUID pendingId, String orderId) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                PendingDonationEntity entity = repository.findById(pendingId)
                        .orElseThrow(() -> new DonationNotFoundException("Pending donation not found: " + pendingId));
                entity.updateFromDomain(entity.toDomain().attachOrder(orderId));
                repository.save(entity);
            });
        } catch (DataAccessException | DonationNotFoundException | IllegalStateException e) {
            log.error("Failed to link PayPal order to pending donation: pendingId={}, orderId={}, error={}",
                    pendingId, orderId, e.getMessage());
            throw new DonationPersistenceException("Failed to link payment", e);
        }
        log.info("PayPal order linked: pendingId={}, orderId={}", pendingId, orderId);
    }

    /**
     * Looks up the pending donation for a PayPal order. Lookup errors are logged
     * and reported as not found so that capture can continue with provider data.
     */
    public Optional<PendingDonation> findByOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return Optional.empty();
        }
        try {
            return repository.findFirstByPaypalOrderIdOrderByCreatedAtDesc(orderId)
                    .map(PendingDonationEntity::toDomain);
        } catch (DataAccessException e) {
            log.error("Pending donation lookup failed: orderId={}, error={}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<PendingDonation> findById(UUID pendingId) {
        return repository.findById(pendingId).map(PendingDonationEntity::toDomain);
    }

    public BestEffortResult markCompleted(String orderId, UUID donationId) {
        return BestEffortResult.attempt("mark pending donation completed", () ->
                transactionTemplate.executeWithoutResult(status -> {
                    PendingDonationEntity entity = repository.findFirstByPaypalOrderIdOrderByCreatedAtDesc(orderId)
                            .orElseThrow(() -> new DonationNotFoundException("No pending donation for order " + orderId));
                    entity.updateFromDomain(entity.toDomain().complete(donationId));
                    repository.save(entity);
                    log.info("Pending donation completed: pendingId={}, orderId={}, donationId={}",
                            entity.getId(), orderId, donationId);
                }));
    }

    public BestEffortResult markFailed(UUID pendingId) {
        return BestEffortResult.attempt("mark pending donation failed", () ->
                transactionTemplate.executeWithoutResult(status -> {
                    PendingDonationEntity entity = repository.findById(pendingId)
                            .orElseThrow(() -> new DonationNotFoundException("Pending donation not found: " + pendingId));
                    fail(entity);
                }));
    }

    public BestEffortResult markFailedByOrderId(String orderId) {
        return BestEffortResult.attempt("mark pending donation failed", () ->
                transactionTemplate.executeWithoutResult(status -> {
                    PendingDonationEntity entity = repository.findFirstByPaypalOrderIdOrderByCreatedAtDesc(orderId)
                            .orElseThrow(() -> new DonationNotFoundException("No pending donation for order " + orderId));
                    fail(entity);
                }));
    }

    private void fail(PendingDonationEntity entity) {
        entity.updateFromDomain(entity.toDomain().fail());
        repository.save(entity);
        log.info("Pending donation failed: pendingId={}, orderId={}", entity.getId(), entity.getPaypalOrderId());
    }
}
