package com.flagship.donation_pipeline.webhook;

import com.flagship.donation_pipeline.PayPalFixtures;
import com.flagship.donation_pipeline.config.PayPalProperties;
import com.flagship.donation_pipeline.exception.WebhookAuthenticationException;
import com.flagship.donation_pipeline.observability.DonationMetrics;
import com.flagship.donation_pipeline.pending.PendingDonationStore;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.provider.WebhookSignature;
import com.flagship.donation_pipeline.subscription.SubscriptionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookDispatcherTest {

    private static final WebhookSignature SIGNATURE =
            new WebhookSignature("SHA256withRSA", "https://cert", "tx-1", "sig", "2024-06-01T10:20:00Z");

    private PayPalClient payPalClient;
    private PayPalProperties properties;
    private SubscriptionService subscriptionService;
    private SimpleMeterRegistry registry;
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        payPalClient = mock(PayPalClient.class);
        subscriptionService = mock(SubscriptionService.class);
        properties = new PayPalProperties();
        registry = new SimpleMeterRegistry();
        dispatcher = new WebhookDispatcher(payPalClient, properties, mock(PendingDonationStore.class),
                subscriptionService, new DonationMetrics(registry));
    }

    @Test
    @DisplayName("Without a webhook id the event is accepted unverified and counted")
    void testReceive_VerificationDisabled() {
        WebhookResult result = dispatcher.receive(PayPalFixtures.read(
                "{\"event_type\":\"CHECKOUT.ORDER.APPROVED\",\"resource\":{\"id\":\"ORDER-9\"}}"), SIGNATURE);

        assertTrue(result.isProcessed());
        assertEquals("order_approved", result.getAction());
        assertEquals("ORDER-9", result.getCorrelatingId());
        assertEquals(1.0, registry.counter("paypal.webhook.unverified").count());
        verify(payPalClient, never()).verifyWebhookSignature(any(), any());
    }

    @Test
    @DisplayName("Placeholder webhook id leaves verification disabled")
    void testReceive_PlaceholderWebhookId() {
        properties.setWebhookId("your_webhook_id_here");

        dispatcher.receive(PayPalFixtures.read("{\"event_type\":\"PAYMENT.CAPTURE.COMPLETED\",\"resource\":{}}"),
                SIGNATURE);

        verify(payPalClient, never()).verifyWebhookSignature(any(), any());
    }

    @Test
    @DisplayName("Failed verification throws before any side effect")
    void testReceive_InvalidSignature() {
        properties.setWebhookId("WH-1");
        when(payPalClient.verifyWebhookSignature(any(), any())).thenReturn(false);

        assertThrows(WebhookAuthenticationException.class, () -> dispatcher.receive(PayPalFixtures.read(
                "{\"event_type\":\"BILLING.SUBSCRIPTION.CANCELLED\",\"resource\":{\"id\":\"I-1\"}}"), SIGNATURE));
        verify(subscriptionService, never()).updateSubscriptionStatus(any(), any());
    }

    @Test
    @DisplayName("Sale without a billing agreement is acknowledged without recording")
    void testDispatch_OneTimeSale() {
        WebhookResult result = dispatcher.dispatch(PayPalFixtures.read(
                "{\"event_type\":\"PAYMENT.SALE.COMPLETED\",\"resource\":{\"id\":\"SALE-9\"}}"));

        assertEquals("recurring_payment", result.getAction());
        verify(subscriptionService, never()).recordRecurringPayment(any());
        assertEquals(1.0, registry.counter("paypal.webhook.received",
                "event_type", "PAYMENT_SALE_COMPLETED", "action", "recurring_payment").count());
    }

    @Test
    @DisplayName("Missing event type is unhandled")
    void testDispatch_MissingEventType() {
        WebhookResult result = dispatcher.dispatch(PayPalFixtures.read("{\"resource\":{}}"));

        assertFalse(result.isProcessed());
        assertEquals("unhandled_event_type", result.getReason());
    }
}
