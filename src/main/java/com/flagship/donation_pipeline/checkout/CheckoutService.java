package com.flagship.donation_pipeline.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.capture.CorrelationBlob;
import com.flagship.donation_pipeline.capture.DonationCaptureService;
import com.flagship.donation_pipeline.checkout.dto.CaptureRequest;
import com.flagship.donation_pipeline.checkout.dto.CaptureResponse;
import com.flagship.donation_pipeline.checkout.dto.CreateOrderResponse;
import com.flagship.donation_pipeline.checkout.dto.DonationStatusResponse;
import com.flagship.donation_pipeline.checkout.dto.InitiateResponse;
import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.config.PayPalProperties;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationPersistenceService;
import com.flagship.donation_pipeline.exception.DonationNotFoundException;
import com.flagship.donation_pipeline.exception.DonationValidationException;
import com.flagship.donation_pipeline.exception.PaymentAlreadyProcessedException;
import com.flagship.donation_pipeline.observability.CorrelationContext;
import com.flagship.donation_pipeline.observability.DonationMetrics;
import com.flagship.donation_pipeline.pending.PendingDonation;
import com.flagship.donation_pipeline.pending.PendingDonationStatus;
import com.flagship.donation_pipeline.pending.PendingDonationStore;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.provider.PayPalLinks;
import com.flagship.donation_pipeline.support.ReferenceGenerator;
import com.flagship.donation_pipeline.validation.DonationInput;
import com.flagship.donation_pipeline.validation.DonationSanitizer;
import com.flagship.donation_pipeline.validation.SanitizationOutcome;
import com.flagship.donation_pipeline.validation.SanitizedDonation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One-time donation checkout: initiation, capture and status polling.
 *
 * Key features:
 * - A pending donation is written before the PayPal order exists, so every order
 *   can be reconciled with the donor's form data
 * - A failure after the pending write rolls the pending donation to failed
 * - Capturing an order whose pending donation is already completed is rejected
 *   before PayPal is called
 */
@Service
@Slf4j
public class CheckoutService {

    private final DonationSanitizer sanitizer;
    private final PayPalClient payPalClient;
    private final PayPalProperties payPalProperties;
    private final DonationProperties donationProperties;
    private final PendingDonationStore pendingStore;
    private final DonationPersistenceService donationPersistence;
    private final DonationCaptureService captureService;
    private final ReferenceGenerator references;
    private final DonationMetrics metrics;
    private final Clock clock;

    public CheckoutService(DonationSanitizer sanitizer,
                           PayPalClient payPalClient,
                           PayPalProperties payPalProperties,
                           DonationProperties donationProperties,
                           PendingDonationStore pendingStore,
                           DonationPersistenceService donationPersistence,
                           DonationCaptureService captureService,
                           ReferenceGenerator references,
                           DonationMetrics metrics,
                           Clock clock) {
        this.sanitizer = sanitizer;
        this.payPalClient = payPalClient;
        this.payPalProperties = payPalProperties;
        this.donationProperties = donationProperties;
        this.pendingStore = pendingStore;
        this.donationPersistence = donationPersistence;
        this.captureService = captureService;
        this.references = references;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validates the form, writes the pending donation, creates the PayPal order and
     * links the two. Amount, donor name and donor email are required.
     */
    public InitiateResponse initiate(DonationInput input) {
        SanitizedDonation donation = sanitizeOrThrow(input, true);
        payPalClient.requireConfigured();

        UUID pendingId = pendingStore.create(donation);
        MDC.put(CorrelationContext.PENDING_ID_MDC_KEY, pendingId.toString());

        try {
            OrderCreated order = createProviderOrder(donation, pendingId, input);
            pendingStore.attachOrder(pendingId, order.orderId());
            metrics.incrementDonationsInitiated();

            log.info("Checkout initiated: pendingId={}, orderId={}, receiptNumber={}, amount={} {}",
                    pendingId, order.orderId(), order.receiptNumber(), donation.getAmount(), donation.getCurrency());

            return InitiateResponse.builder()
                    .pendingId(pendingId)
                    .orderId(order.orderId())
                    .approvalUrl(order.approvalUrl())
                    .receiptNumber(order.receiptNumber())
                    .build();
        } catch (RuntimeException e) {
            log.error("Checkout initiation failed, marking pending donation failed: pendingId={}, error={}",
                    pendingId, e.getMessage());
            pendingStore.markFailed(pendingId);
            throw e;
        }
    }

    /**
     * Legacy flow: creates a PayPal order without a pending donation. The capture
     * then relies on the form data the browser sends back.
     */
    public CreateOrderResponse createOrder(DonationInput input) {
        SanitizedDonation donation = sanitizeOrThrow(input, false);
        OrderCreated order = createProviderOrder(donation, null, input);
        log.info("Legacy order created: orderId={}, receiptNumber={}", order.orderId(), order.receiptNumber());
        return CreateOrderResponse.builder()
                .orderId(order.orderId())
                .approvalUrl(order.approvalUrl())
                .receiptNumber(order.receiptNumber())
                .status(order.status())
                .build();
    }

    public CaptureResponse capture(CaptureRequest request) {
        String orderId = request.getOrderId();
        if (orderId == null || orderId.isBlank()) {
            throw new DonationValidationException("Order ID is required");
        }

        Optional<PendingDonation> pending = pendingStore.findByOrderId(orderId);
        if (pending.isPresent() && pending.get().getStatus() == PendingDonationStatus.COMPLETED) {
            throw new PaymentAlreadyProcessedException(orderId, pending.get().getCompletedDonationId());
        }

        return CaptureResponse.from(captureService.capture(orderId, request.getDonationData()));
    }

    public DonationStatusResponse status(UUID pendingId) {
        PendingDonation pending = pendingStore.findById(pendingId)
                .orElseThrow(() -> new DonationNotFoundException("Pending donation not found: " + pendingId));

        Donation donation = null;
        if (pending.getCompletedDonationId() != null) {
            donation = donationPersistence.findById(pending.getCompletedDonationId()).orElse(null);
        }
        return DonationStatusResponse.of(pending, pending.effectiveStatus(clock.instant()), donation);
    }

    String defaultReturnUrl() {
        return donationProperties.getFrontendUrl() + "/donation?status=success";
    }

    String defaultCancelUrl() {
        return donationProperties.getFrontendUrl() + "/donation?status=cancelled";
    }

    private SanitizedDonation sanitizeOrThrow(DonationInput input, boolean donorIdentityRequired) {
        SanitizationOutcome outcome = sanitizer.sanitize(input, donorIdentityRequired);
        if (!outcome.isValid()) {
            throw new DonationValidationException("Validation failed", outcome.getErrors());
        }
        return outcome.getSanitized();
    }

    private OrderCreated createProviderOrder(SanitizedDonation donation, UUID pendingId, DonationInput input) {
        String receiptNumber = references.newReceiptNumber();
        CorrelationBlob correlation = new CorrelationBlob(
                pendingId == null ? null : pendingId.toString(),
                receiptNumber,
                donation.getDonationType().getValue());

        Map<String, Object> amount = new LinkedHashMap<>();
        amount.put("currency_code", donation.getCurrency());
        amount.put("value", donation.getAmount().toPlainString());

        Map<String, Object> purchaseUnit = new LinkedHashMap<>();
        purchaseUnit.put("reference_id", receiptNumber);
        purchaseUnit.put("description", truncate("Donation: " + donation.getCampaignName(), 127));
        purchaseUnit.put("custom_id", correlation.serialize());
        purchaseUnit.put("amount", amount);

        Map<String, Object> experience = new LinkedHashMap<>();
        experience.put("payment_method_preference", "IMMEDIATE_PAYMENT_REQUIRED");
        experience.put("brand_name", payPalProperties.getBrandName());
        experience.put("locale", "en-US");
        experience.put("landing_page", "LOGIN");
        experience.put("shipping_preference", "NO_SHIPPING");
        experience.put("user_action", "PAY_NOW");
        experience.put("return_url", orDefault(input.getReturnUrl(), defaultReturnUrl()));
        experience.put("cancel_url", orDefault(input.getCancelUrl(), defaultCancelUrl()));

        Map<String, Object> order = new LinkedHashMap<>();
        order.put("intent", "CAPTURE");
        order.put("purchase_units", List.of(purchaseUnit));
        order.put("payment_source", Map.of("paypal", Map.of("experience_context", experience)));

        JsonNode created = payPalClient.createOrder(order);
        return new OrderCreated(
                created.path("id").asText(),
                created.path("status").asText(null),
                PayPalLinks.find(created, "payer-action", "approve").orElse(null),
                receiptNumber);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private record OrderCreated(String orderId, String status, String approvalUrl, String receiptNumber) {}
}
