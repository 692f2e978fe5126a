package com.flagship.donation_pipeline.donation;

import com.flagship.donation_pipeline.exception.DonationPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps PayPal transaction ids to the donation already recorded for them.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable or absent)
 * 2. Fall back to the donations table (source of truth)
 * 3. Warm Redis on a database hit
 *
 * A Redis miss is never trusted on its own; only the database can say "not recorded".
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "donation-tx:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final DonationRepository donationRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(DonationRepository donationRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.donationRepository = donationRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the donation recorded for the transaction, if any
     */
    public Optional<UUID> findRecordedDonation(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Transaction id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String donationId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + transactionId);
                if (donationId != null) {
                    log.debug("Transaction found in Redis: {}", transactionId);
                    return Optional.of(UUID.fromString(donationId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for transaction {}. Falling back to database. Error: {}",
                        transactionId, e.getMessage());
            }
        }

        Optional<DonationEntity> existing;
        try {
            existing = donationRepository.findByTransactionId(transactionId);
        } catch (DataAccessException e) {
            log.error("Database lookup failed for transaction {}. Error: {}", transactionId, e.getMessage());
            throw new DonationPersistenceException("Failed to check for an existing donation", e);
        }

        existing.ifPresent(entity -> cache(transactionId, entity.getId()));
        return existing.map(DonationEntity::getId);
    }

    /**
     * Caches the mapping in Redis after a successful insert. The donations row
     * itself is the durable record.
     */
    public void remember(String transactionId, UUID donationId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Transaction id cannot be null or blank");
        }
        if (donationId == null) {
            throw new IllegalArgumentException("Donation id cannot be null");
        }
        cache(transactionId, donationId);
    }

    private void cache(String transactionId, UUID donationId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + transactionId, donationId.toString(), REDIS_TTL);
            log.debug("Cached transaction in Redis: {} -> {}", transactionId, donationId);
        } catch (Exception e) {
            log.warn("Failed to cache transaction {} in Redis. Error: {}", transactionId, e.getMessage());
        }
    }
}
