package com.flagship.donation_pipeline.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationRecorder;
import com.flagship.donation_pipeline.donation.DonationStatus;
import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.donation.RecordedDonation;
import com.flagship.donation_pipeline.exception.DonationValidationException;
import com.flagship.donation_pipeline.exception.PaymentRecordingException;
import com.flagship.donation_pipeline.notification.DonationReceiptNotifier;
import com.flagship.donation_pipeline.observability.CorrelationContext;
import com.flagship.donation_pipeline.observability.DonationMetrics;
import com.flagship.donation_pipeline.pending.PendingDonation;
import com.flagship.donation_pipeline.pending.PendingDonationStatus;
import com.flagship.donation_pipeline.pending.PendingDonationStore;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.validation.DonationInput;
import com.flagship.donation_pipeline.validation.DonationSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Captures an approved PayPal order and records exactly one donation for it.
 *
 * Steps:
 * 1. Validate the order id before any network call; an order that already has a
 *    donation is answered from that donation without calling PayPal
 * 2. Capture at PayPal; anything but COMPLETED fails the whole operation
 * 3. Parse the capture and its correlation blob
 * 4. Record the donation once per transaction id (a replay returns the prior row)
 * 5. Mark the pending donation completed and send the receipt, both best-effort
 *
 * Once PayPal has captured the money, any failure to record it is raised as
 * {@link PaymentRecordingException} with the transaction id, never swallowed.
 */
@Service
@Slf4j
public class DonationCaptureService {

    static final String DEFAULT_PURPOSE = "General Donation";
    static final String ANONYMOUS = "Anonymous";

    private static final Pattern ORDER_ID = Pattern.compile("^[A-Za-z0-9-]{1,50}$");
    private static final String DESCRIPTION_PREFIX = "Donation: ";

    private final PayPalClient payPalClient;
    private final CaptureResponseParser parser;
    private final PendingDonationStore pendingStore;
    private final DonationRecorder recorder;
    private final DonationSanitizer sanitizer;
    private final DonationReceiptNotifier receiptNotifier;
    private final DonationMetrics metrics;
    private final Clock clock;

    public DonationCaptureService(PayPalClient payPalClient,
                                  CaptureResponseParser parser,
                                  PendingDonationStore pendingStore,
                                  DonationRecorder recorder,
                                  DonationSanitizer sanitizer,
                                  DonationReceiptNotifier receiptNotifier,
                                  DonationMetrics metrics,
                                  Clock clock) {
        this.payPalClient = payPalClient;
        this.parser = parser;
        this.pendingStore = pendingStore;
        this.recorder = recorder;
        this.sanitizer = sanitizer;
        this.receiptNotifier = receiptNotifier;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param orderId PayPal order id from the return redirect
     * @param donorData form data the browser kept across the redirect, used when
     *                  the order has no pending donation; may be {@code null}
     */
    public CaptureOutcome capture(String orderId, DonationInput donorData) {
        validateOrderId(orderId);
        long startTime = clock.millis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId);

        Optional<Donation> alreadyRecorded = recorder.findRecordedOrder(orderId);
        if (alreadyRecorded.isPresent()) {
            return replayRecorded(orderId, alreadyRecorded.get());
        }

        log.info("Capturing PayPal order");

        JsonNode response = payPalClient.captureOrder(orderId);
        CaptureResult capture = parser.parse(response);

        Optional<PendingDonation> pending = pendingStore.findByOrderId(orderId);
        pending.ifPresent(p -> MDC.put(CorrelationContext.PENDING_ID_MDC_KEY, p.getId().toString()));
        if (pending.isEmpty()) {
            log.info("No pending donation for order, recording from PayPal data: transactionId={}",
                    capture.getTransactionId());
        }

        RecordedDonation recorded;
        try {
            recorded = recorder.recordOnce(buildDonation(orderId, capture, pending.orElse(null), donorData));
        } catch (RuntimeException e) {
            metrics.incrementRecordingFailures();
            log.error("PAYMENT CAPTURED BUT NOT RECORDED: transactionId={}, amount={} {}, error={}",
                    capture.getTransactionId(), capture.getGrossAmount(), capture.getCurrency(), e.getMessage(), e);
            throw new PaymentRecordingException(capture.getTransactionId(), orderId, e);
        }

        Donation donation = recorded.getDonation();
        if (pending.isPresent() && pending.get().getStatus() != PendingDonationStatus.COMPLETED) {
            pendingStore.markCompleted(orderId, donation.getId());
        }

        if (recorded.isCreated()) {
            receiptNotifier.sendReceipt(donation);
            metrics.recordDonationCaptured(donation.getDonationType().getValue(), donation.getCurrency());
        } else {
            metrics.incrementDuplicateCaptures();
        }

        long duration = clock.millis() - startTime;
        metrics.recordCaptureDuration(Duration.ofMillis(duration));
        log.info("Capture finished: donationId={}, transactionId={}, gross={}, fee={}, net={}, newlyRecorded={}, duration={}ms",
                donation.getId(), capture.getTransactionId(), capture.getGrossAmount(), capture.getPaypalFee(),
                capture.getNetAmount(), recorded.isCreated(), duration);

        return new CaptureOutcome(donation, capture, recorded.isCreated());
    }

    private CaptureOutcome replayRecorded(String orderId, Donation donation) {
        log.info("Order already recorded, not capturing again: donationId={}, transactionId={}",
                donation.getId(), donation.getTransactionId());
        pendingStore.findByOrderId(orderId)
                .filter(p -> p.getStatus() != PendingDonationStatus.COMPLETED)
                .ifPresent(p -> pendingStore.markCompleted(orderId, donation.getId()));
        metrics.incrementDuplicateCaptures();
        return new CaptureOutcome(donation, parser.fromRecorded(donation), false);
    }

    static void validateOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            throw new DonationValidationException("Order ID is required");
        }
        if (!ORDER_ID.matcher(orderId).matches()) {
            throw new DonationValidationException("Invalid order ID");
        }
    }

    /**
     * Donor identity comes from the pending donation, then the browser-kept form
     * data, then the PayPal payer, then anonymous placeholders.
     */
    Donation buildDonation(String orderId, CaptureResult capture, PendingDonation pending, DonationInput donorData) {
        DonationInput form = donorData == null ? new DonationInput() : donorData;

        String donorName = firstPresent(
                pending == null ? null : pending.getDonorName(),
                sanitizer.sanitizeText(form.getDonorName(), 100),
                capture.getPayerName(),
                ANONYMOUS);
        String donorEmail = firstPresent(
                pending == null ? null : pending.getDonorEmail(),
                sanitizer.validateEmail(form.getDonorEmail()),
                sanitizer.validateEmail(capture.getPayerEmail()));
        String donorPhone = firstPresent(
                pending == null ? null : pending.getDonorPhone(),
                sanitizer.sanitizeText(form.getDonorPhone(), 20));
        String purpose = firstPresent(
                pending == null ? null : pending.getCampaignName(),
                sanitizer.sanitizeText(form.getCampaignName(), 200),
                stripDescriptionPrefix(capture.getPurchaseDescription()),
                DEFAULT_PURPOSE);
        String message = firstPresent(
                pending == null ? null : pending.getMessage(),
                sanitizer.sanitizeText(form.getMessage(), 500),
                purpose);

        DonationType donationType = resolveType(pending, form, capture.getCorrelation());

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (pending != null && pending.getMetadata() != null) {
            metadata.putAll(pending.getMetadata());
        } else if (form.getMetadata() != null) {
            metadata.putAll(sanitizer.sanitizeMetadata(form.getMetadata(), null));
        }
        metadata.put("transaction_id", capture.getTransactionId());
        metadata.put("receipt_number", capture.getReceiptNumber());
        metadata.put("gross_amount", capture.getGrossAmount().toPlainString());
        metadata.put("net_amount", capture.getNetAmount().toPlainString());
        metadata.put("paypal_fee", capture.getPaypalFee().toPlainString());
        metadata.put("paypal_order_id", orderId);
        metadata.put("paypal_payer_id", capture.getPayerId());
        metadata.put("payment_provider", Donation.PROVIDER_PAYPAL);
        metadata.put("pending_donation_id", pending != null
                ? pending.getId().toString()
                : capture.getCorrelation().getPendingId());
        metadata.put("captured_at", capture.getCapturedAt().toString());

        return Donation.builder()
                .donorName(donorName)
                .donorEmail(donorEmail)
                .donorPhone(donorPhone)
                .amount(capture.getGrossAmount())
                .currency(capture.getCurrency())
                .donationType(donationType)
                .status(DonationStatus.COMPLETED)
                .paymentMethod(Donation.PAYMENT_METHOD_ONLINE)
                .paymentProvider(Donation.PROVIDER_PAYPAL)
                .purpose(purpose)
                .message(message)
                .transactionId(capture.getTransactionId())
                .providerOrderId(orderId)
                .receiptNumber(capture.getReceiptNumber())
                .metadata(metadata)
                .donationDate(LocalDate.ofInstant(capture.getCapturedAt(), ZoneOffset.UTC))
                .build();
    }

    /**
     * An out-of-set type from the form or the correlation blob is a defect and
     * fails with {@code InvalidDonationTypeException}; it is never coerced.
     */
    private DonationType resolveType(PendingDonation pending, DonationInput form, CorrelationBlob correlation) {
        if (pending != null && pending.getDonationType() != null) {
            return pending.getDonationType();
        }
        if (!isBlank(form.getDonationType())) {
            return DonationType.require(form.getDonationType());
        }
        if (!isBlank(correlation.getDonationType())) {
            return DonationType.require(correlation.getDonationType());
        }
        if (!isBlank(form.getCampaignName())) {
            return sanitizer.mapToDonationType(form.getCampaignName(), null);
        }
        return DonationType.GENERAL;
    }

    private static String stripDescriptionPrefix(String description) {
        if (description == null) {
            return null;
        }
        return description.startsWith(DESCRIPTION_PREFIX)
                ? description.substring(DESCRIPTION_PREFIX.length())
                : description;
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (!isBlank(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
