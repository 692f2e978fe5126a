package com.flagship.donation_pipeline.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.config.PayPalProperties;
import com.flagship.donation_pipeline.exception.PaymentProviderException;
import com.flagship.donation_pipeline.exception.WebhookAuthenticationException;
import com.flagship.donation_pipeline.observability.DonationMetrics;
import com.flagship.donation_pipeline.pending.PendingDonationStore;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.provider.WebhookSignature;
import com.flagship.donation_pipeline.subscription.SubscriptionService;
import com.flagship.donation_pipeline.support.BestEffortResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifies PayPal webhook deliveries and routes each event type to its side effect.
 *
 * Routing:
 * - CHECKOUT.ORDER.APPROVED, PAYMENT.CAPTURE.COMPLETED, PAYMENT.CAPTURE.REFUNDED: acknowledged only
 *   (captures are recorded by the capture flow)
 * - PAYMENT.CAPTURE.DENIED / DECLINED: pending donation for the order marked failed
 * - BILLING.SUBSCRIPTION.ACTIVATED: subscription row upserted
 * - BILLING.SUBSCRIPTION.CANCELLED / SUSPENDED: subscription rows updated
 * - PAYMENT.SALE.COMPLETED: recurring charge recorded once per sale id
 *
 * Side-effect failures are logged and never turned into an error response, so
 * PayPal does not keep redelivering an event that cannot succeed.
 */
@Service
@Slf4j
public class WebhookDispatcher {

    private final PayPalClient payPalClient;
    private final PayPalProperties properties;
    private final PendingDonationStore pendingStore;
    private final SubscriptionService subscriptionService;
    private final DonationMetrics metrics;

    public WebhookDispatcher(PayPalClient payPalClient,
                             PayPalProperties properties,
                             PendingDonationStore pendingStore,
                             SubscriptionService subscriptionService,
                             DonationMetrics metrics) {
        this.payPalClient = payPalClient;
        this.properties = properties;
        this.pendingStore = pendingStore;
        this.subscriptionService = subscriptionService;
        this.metrics = metrics;
    }

    /**
     * Verifies the delivery when a webhook id is configured, then dispatches it.
     *
     * @throws WebhookAuthenticationException when verification is enabled and fails
     */
    public WebhookResult receive(JsonNode event, WebhookSignature signature) {
        if (properties.isWebhookVerificationEnabled()) {
            if (!verify(event, signature)) {
                log.error("Invalid webhook signature: transmissionId={}, eventType={}",
                        signature.getTransmissionId(), event.path("event_type").asText(null));
                throw new WebhookAuthenticationException("Invalid signature");
            }
        } else {
            metrics.incrementUnverifiedWebhooks();
            log.warn("Webhook id not configured, accepting event without signature verification: eventType={}",
                    event.path("event_type").asText(null));
        }
        return dispatch(event);
    }

    public WebhookResult dispatch(JsonNode event) {
        String eventType = event.path("event_type").asText(null);
        JsonNode resource = event.path("resource");
        String resourceId = resource.path("id").asText(null);

        log.info("Webhook received: eventType={}, resourceId={}", eventType, resourceId);

        WebhookResult result = switch (eventType == null ? "" : eventType) {
            case "CHECKOUT.ORDER.APPROVED" -> WebhookResult.handled(eventType, "order_approved", resourceId);
            case "PAYMENT.CAPTURE.COMPLETED" -> WebhookResult.handled(eventType, "payment_completed", resourceId);
            case "PAYMENT.CAPTURE.DENIED", "PAYMENT.CAPTURE.DECLINED" -> {
                String orderId = resource.path("supplementary_data").path("related_ids").path("order_id").asText(null);
                if (orderId != null) {
                    pendingStore.markFailedByOrderId(orderId);
                }
                yield WebhookResult.handled(eventType, "payment_failed", resourceId);
            }
            case "PAYMENT.CAPTURE.REFUNDED" -> WebhookResult.handled(eventType, "payment_refunded", resourceId);
            case "BILLING.SUBSCRIPTION.ACTIVATED" -> {
                BestEffortResult.attempt("record activated subscription",
                        () -> subscriptionService.recordSubscription(resource, "ACTIVE", null));
                yield WebhookResult.handled(eventType, "subscription_activated", resourceId);
            }
            case "BILLING.SUBSCRIPTION.CANCELLED" -> {
                BestEffortResult.attempt("apply subscription cancellation",
                        () -> subscriptionService.updateSubscriptionStatus(resourceId, "CANCELLED"));
                yield WebhookResult.handled(eventType, "subscription_cancelled", resourceId);
            }
            case "BILLING.SUBSCRIPTION.SUSPENDED" -> {
                BestEffortResult.attempt("apply subscription suspension",
                        () -> subscriptionService.updateSubscriptionStatus(resourceId, "SUSPENDED"));
                yield WebhookResult.handled(eventType, "subscription_suspended", resourceId);
            }
            case "PAYMENT.SALE.COMPLETED" -> {
                if (resource.hasNonNull("billing_agreement_id")) {
                    BestEffortResult.attempt("record recurring payment",
                            () -> subscriptionService.recordRecurringPayment(resource));
                }
                yield WebhookResult.handled(eventType, "recurring_payment", resourceId);
            }
            default -> WebhookResult.unhandled(eventType);
        };

        metrics.recordWebhook(eventType, result.isProcessed() ? result.getAction() : "unhandled");
        return result;
    }

    private boolean verify(JsonNode event, WebhookSignature signature) {
        try {
            return payPalClient.verifyWebhookSignature(signature, event);
        } catch (PaymentProviderException e) {
            log.error("Webhook verification call failed: status={}, error={}", e.getStatus(), e.getMessage());
            return false;
        }
    }
}
