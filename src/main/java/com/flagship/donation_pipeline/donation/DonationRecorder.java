package com.flagship.donation_pipeline.donation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Records exactly one donation per PayPal transaction id.
 *
 * The redirect-driven capture and a webhook for the same transaction may run
 * concurrently. A replay is answered by the pre-check. Two racing inserts hit the
 * unique constraint on transaction_id, and the losing insert resolves to the row
 * the winner wrote.
 *
 * Not @Transactional: the insert runs in its own transaction and the unique
 * violation is caught here, after that transaction has rolled back.
 */
@Service
@Slf4j
public class DonationRecorder {

    private final DonationPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;

    public DonationRecorder(DonationPersistenceService persistenceService,
                            IdempotencyService idempotencyService) {
        this.persistenceService = persistenceService;
        this.idempotencyService = idempotencyService;
    }

    /**
     * The donation already recorded for a PayPal order, if any. A captured order
     * cannot be captured again, so a hit means the capture already happened.
     */
    public Optional<Donation> findRecordedOrder(String orderId) {
        return persistenceService.findByProviderOrderId(orderId);
    }

    /**
     * @param candidate donation to insert, with a non-blank transaction id
     * @return the inserted donation, or the one already recorded for the transaction
     */
    public RecordedDonation recordOnce(Donation candidate) {
        String transactionId = candidate.getTransactionId();

        Optional<Donation> prior = idempotencyService.findRecordedDonation(transactionId)
                .flatMap(persistenceService::findById);
        if (prior.isPresent()) {
            log.info("Transaction already recorded: transactionId={}, donationId={}",
                    transactionId, prior.get().getId());
            return new RecordedDonation(prior.get(), false);
        }

        Donation toInsert = candidate.getId() == null
                ? candidate.toBuilder().id(UUID.randomUUID()).build()
                : candidate;
        try {
            Donation inserted = persistenceService.insert(toInsert);
            idempotencyService.remember(transactionId, inserted.getId());
            log.info("Donation recorded: donationId={}, transactionId={}, amount={}, type={}",
                    inserted.getId(), transactionId, inserted.getAmount(), inserted.getDonationType().getValue());
            return new RecordedDonation(inserted, true);
        } catch (DataIntegrityViolationException e) {
            Donation winner = persistenceService.findByTransactionId(transactionId).orElseThrow(() -> e);
            log.info("Concurrent recording resolved to existing donation: transactionId={}, donationId={}",
                    transactionId, winner.getId());
            idempotencyService.remember(transactionId, winner.getId());
            return new RecordedDonation(winner, false);
        }
    }
}
