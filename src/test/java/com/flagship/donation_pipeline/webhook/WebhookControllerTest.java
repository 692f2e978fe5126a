package com.flagship.donation_pipeline.webhook;

import com.flagship.donation_pipeline.PayPalFixtures;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationPersistenceService;
import com.flagship.donation_pipeline.donation.DonationRepository;
import com.flagship.donation_pipeline.donation.DonationStatus;
import com.flagship.donation_pipeline.exception.PaymentProviderException;
import com.flagship.donation_pipeline.pending.PendingDonationRepository;
import com.flagship.donation_pipeline.pending.PendingDonationStatus;
import com.flagship.donation_pipeline.pending.PendingDonationStore;
import com.flagship.donation_pipeline.provider.PayPalClient;
import com.flagship.donation_pipeline.validation.DonationInput;
import com.flagship.donation_pipeline.validation.DonationSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Webhook endpoint tests.
 *
 * These tests verify:
 * - Deliveries failing signature verification are rejected with 401
 * - Subscription and sale events update local donation rows
 * - Redelivered sale events never create a second donation
 * - Unknown event types are acknowledged as unhandled
 */
@SpringBootTest
@AutoConfigureMockMvc
class WebhookControllerTest {

    @MockBean
    private PayPalClient payPalClient;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DonationRepository donationRepository;

    @Autowired
    private PendingDonationRepository pendingRepository;

    @Autowired
    private DonationPersistenceService persistenceService;

    @Autowired
    private PendingDonationStore pendingStore;

    @Autowired
    private DonationSanitizer sanitizer;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        donationRepository.deleteAll();
        pendingRepository.deleteAll();
        when(payPalClient.verifyWebhookSignature(any(), any())).thenReturn(true);
    }

    private ResultActions deliver(String event) throws Exception {
        return mockMvc.perform(post("/api/paypal/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header("paypal-auth-algo", "SHA256withRSA")
                .header("paypal-cert-url", "https://api.sandbox.paypal.com/v1/notifications/certs/CERT-1")
                .header("paypal-transmission-id", UUID.randomUUID().toString())
                .header("paypal-transmission-sig", "c2lnbmF0dXJl")
                .header("paypal-transmission-time", "2024-06-01T10:20:00Z")
                .content(event));
    }

    private static String saleEvent(String saleId, String subscriptionId) {
        return """
                {"id": "WH-%s", "event_type": "PAYMENT.SALE.COMPLETED",
                 "resource": {"id": "%s", "billing_agreement_id": "%s", "state": "completed",
                              "amount": {"total": "25.00", "currency": "USD"}}}
                """.formatted(saleId, saleId, subscriptionId);
    }

    @Nested
    @DisplayName("Signature verification")
    class VerificationTests {

        @Test
        @DisplayName("Failed verification is rejected with 401 and nothing is recorded")
        void testWebhook_InvalidSignature() throws Exception {
            printTestHeader("Webhook: Invalid Signature");
            when(payPalClient.verifyWebhookSignature(any(), any())).thenReturn(false);

            deliver(saleEvent("SALE-BAD", "I-SUB1"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("Invalid signature"));

            assertEquals(0, donationRepository.count());
            printSuccess("Forged delivery rejected");
        }

        @Test
        @DisplayName("Verification call failure is treated as an invalid signature")
        void testWebhook_VerificationUnavailable() throws Exception {
            when(payPalClient.verifyWebhookSignature(any(), any()))
                    .thenThrow(new PaymentProviderException("PayPal is unreachable", 503, null));

            deliver(saleEvent("SALE-UNV", "I-SUB1")).andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("Event dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Redelivered sale event records one donation")
        void testWebhook_SaleRedeliveryIsIdempotent() throws Exception {
            printTestHeader("Webhook: Sale Redelivery");

            deliver(saleEvent("SALE-100", "I-SUB100"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.processed").value(true))
                    .andExpect(jsonPath("$.action").value("recurring_payment"))
                    .andExpect(jsonPath("$.correlatingId").value("SALE-100"));
            deliver(saleEvent("SALE-100", "I-SUB100"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.processed").value(true));

            List<Donation> rows = persistenceService.findBySubscriptionId("I-SUB100");
            assertEquals(1, rows.size());
            assertEquals("SALE-100", rows.get(0).getTransactionId());
            printSuccess("One donation for two deliveries");
        }

        @Test
        @DisplayName("Activation then cancellation events keep the subscription row in sync")
        void testWebhook_SubscriptionLifecycle() throws Exception {
            printTestHeader("Webhook: Subscription Lifecycle");
            String subscription = PayPalFixtures.subscription("I-SUB200", "ACTIVE").toString();
            String otherSubscription = PayPalFixtures.subscription("I-SUB201", "ACTIVE").toString();

            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.ACTIVATED\", \"resource\": " + subscription + "}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("subscription_activated"));
            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.ACTIVATED\", \"resource\": " + otherSubscription + "}")
                    .andExpect(status().isOk());
            deliver(saleEvent("SALE-201", "I-SUB201")).andExpect(status().isOk());

            Donation row = persistenceService.findSubscriptionRow("I-SUB200").orElseThrow();
            assertEquals(DonationStatus.COMPLETED, row.getStatus());
            assertEquals("Arjun Rao", row.getDonorName());

            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.CANCELLED\", \"resource\": " + subscription + "}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("subscription_cancelled"));

            assertEquals(DonationStatus.CANCELLED,
                    persistenceService.findSubscriptionRow("I-SUB200").orElseThrow().getStatus());
            List<Donation> otherRows = persistenceService.findBySubscriptionId("I-SUB201");
            assertEquals(2, otherRows.size());
            otherRows.forEach(other -> assertEquals(DonationStatus.COMPLETED, other.getStatus()));
            assertEquals("ACTIVE", persistenceService.findSubscriptionRow("I-SUB201").orElseThrow()
                    .getMetadata().get("subscription_status"));

            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.ACTIVATED\", \"resource\": " + subscription + "}")
                    .andExpect(status().isOk());

            assertEquals(DonationStatus.CANCELLED,
                    persistenceService.findSubscriptionRow("I-SUB200").orElseThrow().getStatus());
            printSuccess("Only the cancelled subscription changed, and a late activation did not revive it");
        }

        @Test
        @DisplayName("Activation event after /activate-subscription keeps the donor details from the form")
        void testWebhook_ActivationKeepsFormDonorData() throws Exception {
            printTestHeader("Webhook: Activation After Form Activation");
            when(payPalClient.getSubscription("I-SUB300")).thenReturn(PayPalFixtures.subscription("I-SUB300", "ACTIVE"));

            mockMvc.perform(post("/api/paypal/activate-subscription")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"subscriptionId": "I-SUB300",
                                     "donationData": {"donorName": "Meera Iyer", "donorPhone": "555-1234",
                                                      "campaignName": "Puja Seva",
                                                      "metadata": {"gotra": "Kashyapa"}}}
                                    """))
                    .andExpect(status().isOk());

            String subscription = PayPalFixtures.subscription("I-SUB300", "ACTIVE").toString();
            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.ACTIVATED\", \"resource\": " + subscription + "}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("subscription_activated"));

            List<Donation> rows = persistenceService.findBySubscriptionId("I-SUB300");
            assertEquals(1, rows.size());
            Donation row = rows.get(0);
            assertEquals("Meera Iyer", row.getDonorName());
            assertEquals("555-1234", row.getDonorPhone());
            assertEquals("Puja Seva", row.getPurpose());
            assertEquals("Kashyapa", row.getMetadata().get("gotra"));
            assertEquals("subscriber@example.com", row.getDonorEmail());
            assertEquals(DonationStatus.COMPLETED, row.getStatus());
            printSuccess("Subscription row updated, not replaced");
        }

        @Test
        @DisplayName("Denied capture marks the pending donation failed")
        void testWebhook_CaptureDenied() throws Exception {
            UUID pendingId = pendingStore.create(sanitizer.sanitize(DonationInput.builder()
                    .amount("30").donorName("Kavya").donorEmail("kavya@example.com").build(), true).getSanitized());
            pendingStore.attachOrder(pendingId, "ORDER-DENY1");

            deliver("""
                    {"event_type": "PAYMENT.CAPTURE.DENIED",
                     "resource": {"id": "CAP-DENY1",
                                  "supplementary_data": {"related_ids": {"order_id": "ORDER-DENY1"}}}}
                    """)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("payment_failed"));

            assertEquals(PendingDonationStatus.FAILED, pendingStore.findById(pendingId).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Side-effect failure still acknowledges the event")
        void testWebhook_SideEffectFailureAcknowledged() throws Exception {
            deliver("{\"event_type\": \"BILLING.SUBSCRIPTION.SUSPENDED\", \"resource\": {}}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.processed").value(true))
                    .andExpect(jsonPath("$.action").value("subscription_suspended"));
        }

        @Test
        @DisplayName("Unknown event type is acknowledged as unhandled")
        void testWebhook_UnhandledEvent() throws Exception {
            deliver("{\"event_type\": \"CUSTOMER.DISPUTE.CREATED\", \"resource\": {\"id\": \"PP-D-1\"}}")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.processed").value(false))
                    .andExpect(jsonPath("$.reason").value("unhandled_event_type"))
                    .andExpect(jsonPath("$.eventType").value("CUSTOMER.DISPUTE.CREATED"));
        }
    }
}
