package com.flagship.donation_pipeline.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the donation pipeline.
 *
 * Metrics exposed:
 * - donation.initiated: checkouts started (pending record + PayPal order)
 * - donation.captured: captures that recorded a new donation, tagged by type and currency
 * - donation.duplicate_captures: captures answered with an already-recorded donation
 * - donation.recording_failures: payments captured at PayPal but not recorded locally
 * - donation.capture.duration: capture latency including the PayPal call
 * - paypal.webhook.received: webhook events by type and outcome
 * - paypal.webhook.unverified: webhooks accepted without signature verification
 * - donation.rate_limited: requests rejected by the rate limiter
 */
@Component
public class DonationMetrics {

    private final MeterRegistry registry;

    private final Counter donationsInitiated;
    private final Counter duplicateCaptures;
    private final Counter recordingFailures;
    private final Counter unverifiedWebhooks;
    private final Counter rateLimited;

    private final Timer captureTimer;

    public DonationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.donationsInitiated = Counter.builder("donation.initiated")
                .description("Number of donation checkouts started")
                .register(registry);

        this.duplicateCaptures = Counter.builder("donation.duplicate_captures")
                .description("Captures resolved to an already-recorded transaction")
                .register(registry);

        this.recordingFailures = Counter.builder("donation.recording_failures")
                .description("Payments captured at PayPal but not recorded locally")
                .register(registry);

        this.unverifiedWebhooks = Counter.builder("paypal.webhook.unverified")
                .description("Webhooks accepted without signature verification")
                .register(registry);

        this.rateLimited = Counter.builder("donation.rate_limited")
                .description("Requests rejected by the per-client rate limiter")
                .register(registry);

        this.captureTimer = Timer.builder("donation.capture.duration")
                .description("Time taken to capture and record a donation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void incrementDonationsInitiated() {
        donationsInitiated.increment();
    }

    public void recordDonationCaptured(String donationType, String currency) {
        registry.counter("donation.captured",
                "type", sanitizeTag(donationType),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void incrementDuplicateCaptures() {
        duplicateCaptures.increment();
    }

    public void incrementRecordingFailures() {
        recordingFailures.increment();
    }

    public void recordWebhook(String eventType, String action) {
        registry.counter("paypal.webhook.received",
                "event_type", sanitizeTag(eventType),
                "action", sanitizeTag(action)
        ).increment();
    }

    public void incrementUnverifiedWebhooks() {
        unverifiedWebhooks.increment();
    }

    public void incrementRateLimited() {
        rateLimited.increment();
    }

    public void recordCaptureDuration(Duration duration) {
        captureTimer.record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
