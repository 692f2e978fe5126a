package com.flagship.donation_pipeline.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.cache.TtlCache;
import com.flagship.donation_pipeline.config.PayPalProperties;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationPersistenceService;
import com.flagship.donation_pipeline.donation.DonationRecorder;
import com.flagship.donation_pipeline.donation.DonationStatus;
import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.donation.RecordedDonation;
import com.flagship.donation_pipeline.exception.DonationValidationException;
import com.flagship.donation_pipeline.exception.PaymentProviderException;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.provider.PayPalLinks;
import com.flagship.donation_pipeline.validation.AmountValidation;
import com.flagship.donation_pipeline.validation.DonationInput;
import com.flagship.donation_pipeline.validation.DonationSanitizer;
import com.flagship.donation_pipeline.validation.SanitizationOutcome;
import com.flagship.donation_pipeline.validation.SanitizedDonation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Recurring donations: PayPal product/plan provisioning, subscription creation,
 * and the local donation rows that mirror a subscription.
 *
 * Each subscription has one "subscription row" (no transaction id), upserted on
 * activation, plus one row per recurring charge keyed by the PayPal sale id.
 * Status changes apply to every row with the subscription id.
 */
@Service
@Slf4j
public class SubscriptionService {

    static final String PRODUCT_CACHE_KEY = "paypal:product-id";
    static final String DEFAULT_CANCEL_REASON = "Cancelled by user";
    static final String RECURRING_PURPOSE = "Recurring Donation";
    static final String RECURRING_PAYMENT_PURPOSE = "Recurring Donation Payment";
    static final String RECURRING_DONOR = "Recurring Donor";
    static final String ANONYMOUS_DONOR = "Anonymous";

    private final PayPalClient payPalClient;
    private final PayPalProperties properties;
    private final TtlCache<String, String> cache;
    private final DonationSanitizer sanitizer;
    private final DonationPersistenceService persistenceService;
    private final DonationRecorder recorder;
    private final Clock clock;

    public SubscriptionService(PayPalClient payPalClient,
                               PayPalProperties properties,
                               TtlCache<String, String> cache,
                               DonationSanitizer sanitizer,
                               DonationPersistenceService persistenceService,
                               DonationRecorder recorder,
                               Clock clock) {
        this.payPalClient = payPalClient;
        this.properties = properties;
        this.cache = cache;
        this.sanitizer = sanitizer;
        this.persistenceService = persistenceService;
        this.recorder = recorder;
        this.clock = clock;
    }

    // ==================== Creation ====================

    /**
     * Provisions the product and a billing plan, then creates the subscription.
     * Failures are surfaced; nothing is stored locally until activation.
     */
    public SubscriptionCreated createSubscription(DonationInput input, String returnUrl, String cancelUrl) {
        SanitizationOutcome outcome = sanitizer.sanitize(input, false);
        if (!outcome.isValid()) {
            throw new DonationValidationException("Validation failed", outcome.getErrors());
        }
        SanitizedDonation donation = outcome.getSanitized();
        BillingFrequency frequency = BillingFrequency.fromValue(donation.getFrequency());
        String amount = donation.getAmount().toPlainString();

        JsonNode plan = payPalClient.createPlan(planRequest(productId(), donation, frequency));
        String planId = plan.path("id").asText();

        Map<String, Object> subscriber = new LinkedHashMap<>();
        String[] nameParts = donation.getDonorName().split(" ", 2);
        subscriber.put("name", Map.of(
                "given_name", nameParts[0].isEmpty() ? "Donor" : nameParts[0],
                "surname", nameParts.length > 1 ? nameParts[1] : ""));
        if (donation.getDonorEmail() != null) {
            subscriber.put("email_address", donation.getDonorEmail());
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("plan_id", planId);
        request.put("start_time", clock.instant().plusSeconds(60).truncatedTo(ChronoUnit.SECONDS).toString());
        request.put("subscriber", subscriber);
        request.put("application_context", Map.of(
                "brand_name", properties.getBrandName(),
                "locale", "en-US",
                "shipping_preference", "NO_SHIPPING",
                "user_action", "SUBSCRIBE_NOW",
                "payment_method", Map.of(
                        "payer_selected", "PAYPAL",
                        "payee_preferred", "IMMEDIATE_PAYMENT_REQUIRED"),
                "return_url", returnUrl,
                "cancel_url", cancelUrl));
        request.put("custom_id", new SubscriptionCorrelation(frequency.getValue(), amount).serialize());

        JsonNode subscription = payPalClient.createSubscription(request);
        String subscriptionId = subscription.path("id").asText();
        log.info("Subscription created: subscriptionId={}, planId={}, frequency={}, amount={} {}",
                subscriptionId, planId, frequency.getValue(), amount, donation.getCurrency());

        return SubscriptionCreated.builder()
                .subscriptionId(subscriptionId)
                .planId(planId)
                .status(subscription.path("status").asText(null))
                .approvalUrl(PayPalLinks.find(subscription, "approve").orElse(null))
                .frequency(frequency.getValue())
                .amount(donation.getAmount())
                .build();
    }

    /**
     * Returns the cached product id, else finds the product by name, else creates it.
     */
    String productId() {
        Optional<String> cached = cache.get(PRODUCT_CACHE_KEY);
        if (cached.isPresent()) {
            return cached.get();
        }

        String productId = null;
        try {
            for (JsonNode product : payPalClient.listProducts(20).path("products")) {
                if (properties.getProductName().equals(product.path("name").asText())) {
                    productId = product.path("id").asText();
                    break;
                }
            }
        } catch (PaymentProviderException e) {
            log.warn("Product lookup failed, creating a new product: status={}, error={}",
                    e.getStatus(), e.getMessage());
        }

        if (productId == null) {
            Map<String, Object> product = new LinkedHashMap<>();
            product.put("name", properties.getProductName());
            product.put("description", "Recurring donation subscription for temple support");
            product.put("type", "SERVICE");
            product.put("category", "CHARITY");
            productId = payPalClient.createProduct(product).path("id").asText();
            log.info("PayPal product created: productId={}", productId);
        }

        cache.put(PRODUCT_CACHE_KEY, productId, properties.getProductCacheTtl());
        return productId;
    }

    private Map<String, Object> planRequest(String productId, SanitizedDonation donation, BillingFrequency frequency) {
        String amount = donation.getAmount().toPlainString();
        String currency = donation.getCurrency();

        Map<String, Object> cycle = new LinkedHashMap<>();
        cycle.put("frequency", Map.of(
                "interval_unit", frequency.getIntervalUnit(),
                "interval_count", frequency.getIntervalCount()));
        cycle.put("tenure_type", "REGULAR");
        cycle.put("sequence", 1);
        cycle.put("total_cycles", 0);
        cycle.put("pricing_scheme", Map.of(
                "fixed_price", Map.of("value", amount, "currency_code", currency)));

        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("product_id", productId);
        plan.put("name", truncate(donation.getCampaignName() + " - " + frequency.getValue() + " Donation", 127));
        plan.put("description", truncate("Recurring " + frequency.getValue() + " donation of " + amount, 127));
        plan.put("status", "ACTIVE");
        plan.put("billing_cycles", List.of(cycle));
        plan.put("payment_preferences", Map.of(
                "auto_bill_outstanding", true,
                "setup_fee", Map.of("value", "0", "currency_code", currency),
                "setup_fee_failure_action", "CONTINUE",
                "payment_failure_threshold", 3));
        return plan;
    }

    // ==================== Lookup & activation ====================

    public JsonNode getSubscription(String subscriptionId) {
        requireSubscriptionId(subscriptionId);
        return payPalClient.getSubscription(subscriptionId);
    }

    /**
     * Fetches the subscription from PayPal and upserts its local donation row.
     * Failures are surfaced to the caller.
     *
     * @param donorData form data kept by the browser; may be {@code null}
     */
    public SubscriptionActivation activateSubscription(String subscriptionId, DonationInput donorData) {
        JsonNode subscription = getSubscription(subscriptionId);
        String status = subscription.path("status").asText(null);
        Donation row = recordSubscription(subscription, status, donorData);
        return new SubscriptionActivation(
                subscription.path("id").asText(subscriptionId),
                status,
                subscription.path("plan_id").asText(null),
                row.getId());
    }

    /**
     * Creates or updates the subscription's own donation row.
     *
     * An existing row is updated, not replaced: donor details already on it are
     * kept unless the caller supplies new ones, and a cancelled row stays cancelled.
     */
    public Donation recordSubscription(JsonNode subscription, String providerStatus, DonationInput donorData) {
        String subscriptionId = subscription.path("id").asText(null);
        requireSubscriptionId(subscriptionId);
        DonationInput form = donorData == null ? new DonationInput() : donorData;
        SubscriptionCorrelation correlation = SubscriptionCorrelation.parse(subscription.path("custom_id").asText(null));
        JsonNode subscriber = subscription.path("subscriber");

        String formName = sanitizer.sanitizeText(form.getDonorName(), 100);
        String formEmail = sanitizer.validateEmail(form.getDonorEmail());
        String formPhone = firstPresent(sanitizer.sanitizeText(form.getDonorPhone(), 20));
        String formCampaign = firstPresent(sanitizer.sanitizeText(form.getCampaignName(), 200));
        String formMessage = firstPresent(sanitizer.sanitizeText(form.getMessage(), 500));

        String donorName = firstPresent(
                formName,
                sanitizer.sanitizeText(fullName(subscriber.path("name")), 100),
                ANONYMOUS_DONOR);
        String donorEmail = firstPresent(
                formEmail,
                sanitizer.validateEmail(subscriber.path("email_address").asText(null)));
        String campaignName = firstPresent(formCampaign, RECURRING_PURPOSE);
        String frequency = BillingFrequency.fromValue(firstPresent(
                form.getFrequency(), correlation.getFrequency())).getValue();
        BigDecimal amount = resolveAmount(form, correlation, subscription);

        Map<String, Object> metadata = new LinkedHashMap<>(sanitizer.sanitizeMetadata(form.getMetadata(), null));
        metadata.put("subscription_id", subscriptionId);
        metadata.put("plan_id", subscription.path("plan_id").asText(null));
        metadata.put("frequency", frequency);
        metadata.put("subscription_status", providerStatus);
        metadata.put("start_time", subscription.path("start_time").asText(null));
        metadata.put("is_recurring", true);
        metadata.put("payment_provider", Donation.PROVIDER_PAYPAL);

        DonationStatus status = "ACTIVE".equals(providerStatus) ? DonationStatus.COMPLETED : DonationStatus.PENDING;

        Optional<Donation> existing = persistenceService.findSubscriptionRow(subscriptionId);
        if (existing.isPresent()) {
            Donation current = existing.get();
            boolean cancelled = current.getStatus() == DonationStatus.CANCELLED;
            Map<String, Object> mergedMetadata = new LinkedHashMap<>();
            if (current.getMetadata() != null) {
                mergedMetadata.putAll(current.getMetadata());
            }
            Object storedProviderStatus = mergedMetadata.getOrDefault("subscription_status", "CANCELLED");
            mergedMetadata.putAll(metadata);
            if (cancelled) {
                mergedMetadata.put("subscription_status", storedProviderStatus);
                log.warn("Ignoring status {} for cancelled subscription: subscriptionId={}",
                        providerStatus, subscriptionId);
            }

            Donation merged = current.toBuilder()
                    .donorName(firstPresent(formName, known(current.getDonorName()), donorName))
                    .donorEmail(firstPresent(formEmail, current.getDonorEmail(), donorEmail))
                    .donorPhone(firstPresent(formPhone, current.getDonorPhone()))
                    .amount(hasAmount(form) || isZero(current.getAmount()) ? amount : current.getAmount())
                    .currency(form.getCurrency() != null ? currencyOf(form) : current.getCurrency())
                    .status(cancelled ? current.getStatus() : status)
                    .purpose(firstPresent(formCampaign, current.getPurpose(), campaignName))
                    .message(firstPresent(formMessage, current.getMessage(), campaignName))
                    .metadata(mergedMetadata)
                    .build();

            Donation updated = persistenceService.update(merged);
            log.info("Subscription donation updated: subscriptionId={}, donationId={}, status={}",
                    subscriptionId, updated.getId(), updated.getStatus().getValue());
            return updated;
        }

        Donation candidate = Donation.builder()
                .id(UUID.randomUUID())
                .donorName(donorName)
                .donorEmail(donorEmail)
                .donorPhone(formPhone)
                .amount(amount)
                .currency(currencyOf(form))
                .donationType(DonationType.RECURRING)
                .status(status)
                .paymentMethod(Donation.PAYMENT_METHOD_ONLINE)
                .paymentProvider(Donation.PROVIDER_PAYPAL)
                .purpose(campaignName)
                .message(firstPresent(formMessage, campaignName))
                .subscriptionId(subscriptionId)
                .metadata(metadata)
                .donationDate(LocalDate.now(clock.withZone(ZoneOffset.UTC)))
                .build();

        Donation inserted = persistenceService.insert(candidate);
        log.info("Subscription donation recorded: subscriptionId={}, donationId={}, status={}, amount={}",
                subscriptionId, inserted.getId(), providerStatus, amount);
        return inserted;
    }

    private String currencyOf(DonationInput form) {
        return firstPresent(sanitizer.sanitizeText(form.getCurrency(), 3), "USD").toUpperCase(Locale.ROOT);
    }

    private boolean hasAmount(DonationInput form) {
        return form.getAmount() != null && sanitizer.validateAmount(form.getAmount()).isValid();
    }

    private static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }

    private static String known(String donorName) {
        return ANONYMOUS_DONOR.equals(donorName) ? null : donorName;
    }

    // ==================== Status changes ====================

    /**
     * Cancels at PayPal, then moves every local row for the subscription to cancelled.
     * A failed local update is logged and reported, not raised: the cancellation
     * at PayPal has already happened.
     */
    public SubscriptionCancellation cancelSubscription(String subscriptionId, String reason) {
        requireSubscriptionId(subscriptionId);
        String sanitizedReason = firstPresent(sanitizer.sanitizeText(reason, 128), DEFAULT_CANCEL_REASON);

        payPalClient.cancelSubscription(subscriptionId, sanitizedReason);
        log.info("Subscription cancelled at PayPal: subscriptionId={}", subscriptionId);

        int updated;
        try {
            updated = updateSubscriptionStatus(subscriptionId, "CANCELLED");
        } catch (DataAccessException e) {
            log.error("Subscription cancelled at PayPal but local rows not updated: subscriptionId={}, error={}",
                    subscriptionId, e.getMessage());
            updated = -1;
        }
        return new SubscriptionCancellation(subscriptionId, "CANCELLED", updated);
    }

    /**
     * Applies a provider status (CANCELLED, SUSPENDED, ...) to every donation row
     * of the subscription; the provider string is stored verbatim in metadata.
     *
     * @return number of rows updated
     */
    public int updateSubscriptionStatus(String subscriptionId, String providerStatus) {
        requireSubscriptionId(subscriptionId);
        int updated = persistenceService.updateSubscriptionStatus(
                subscriptionId, DonationStatus.fromSubscriptionStatus(providerStatus), providerStatus);
        log.info("Subscription status applied: subscriptionId={}, status={}, rows={}",
                subscriptionId, providerStatus, updated);
        return updated;
    }

    /**
     * Records one recurring charge (a PayPal sale), at most once per sale id.
     * Donor identity is copied from the subscription row when one exists.
     */
    public RecordedDonation recordRecurringPayment(JsonNode sale) {
        String saleId = sale.path("id").asText(null);
        String subscriptionId = sale.path("billing_agreement_id").asText(null);
        if (saleId == null || saleId.isBlank()) {
            throw new IllegalArgumentException("Recurring payment has no sale id");
        }
        requireSubscriptionId(subscriptionId);

        Optional<Donation> subscriptionRow = persistenceService.findSubscriptionRow(subscriptionId);
        JsonNode amountNode = sale.path("amount");
        BigDecimal amount = parseAmount(firstPresent(
                amountNode.path("total").asText(null),
                amountNode.path("value").asText(null)));
        String currency = firstPresent(
                amountNode.path("currency").asText(null),
                amountNode.path("currency_code").asText(null),
                "USD");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("transaction_id", saleId);
        metadata.put("subscription_id", subscriptionId);
        metadata.put("is_recurring_payment", true);
        metadata.put("payment_provider", Donation.PROVIDER_PAYPAL);

        Donation candidate = Donation.builder()
                .donorName(subscriptionRow.map(Donation::getDonorName).orElse(RECURRING_DONOR))
                .donorEmail(subscriptionRow.map(Donation::getDonorEmail)
                        .orElse(sanitizer.validateEmail(sale.path("payer").path("email_address").asText(null))))
                .donorPhone(subscriptionRow.map(Donation::getDonorPhone).orElse(null))
                .amount(amount)
                .currency(currency)
                .donationType(DonationType.RECURRING)
                .status(DonationStatus.COMPLETED)
                .paymentMethod(Donation.PAYMENT_METHOD_ONLINE)
                .paymentProvider(Donation.PROVIDER_PAYPAL)
                .purpose(RECURRING_PAYMENT_PURPOSE)
                .message(RECURRING_PAYMENT_PURPOSE)
                .transactionId(saleId)
                .subscriptionId(subscriptionId)
                .metadata(metadata)
                .donationDate(LocalDate.now(clock.withZone(ZoneOffset.UTC)))
                .build();

        return recorder.recordOnce(candidate);
    }

    // ==================== Helpers ====================

    private BigDecimal resolveAmount(DonationInput form, SubscriptionCorrelation correlation, JsonNode subscription) {
        if (form.getAmount() != null) {
            AmountValidation validation = sanitizer.validateAmount(form.getAmount());
            if (validation.isValid()) {
                return validation.getValue();
            }
        }
        return parseAmount(firstPresent(
                correlation.getAmount(),
                subscription.path("billing_info").path("last_payment").path("amount").path("value").asText(null)));
    }

    private static BigDecimal parseAmount(String raw) {
        if (raw == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        try {
            return new BigDecimal(raw.trim()).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO.setScale(2);
        }
    }

    private static String fullName(JsonNode name) {
        String full = (name.path("given_name").asText("") + " " + name.path("surname").asText("")).trim();
        return full.isEmpty() ? null : full;
    }

    private static void requireSubscriptionId(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new DonationValidationException("Subscription ID is required");
        }
    }

    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
