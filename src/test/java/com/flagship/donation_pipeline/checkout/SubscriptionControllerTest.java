package com.flagship.donation_pipeline.checkout;

import com.flagship.donation_pipeline.PayPalFixtures;
import com.flagship.donation_pipeline.donation.DonationRepository;
import com.flagship.donation_pipeline.provider.PayPalClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SubscriptionControllerTest {

    @MockBean
    private PayPalClient payPalClient;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DonationRepository donationRepository;

    @BeforeEach
    void setUp() {
        donationRepository.deleteAll();
    }

    @Test
    @DisplayName("Create subscription answers 201 and defaults the return URLs to the recurring page")
    @SuppressWarnings("unchecked")
    void testCreateSubscription_DefaultUrls() throws Exception {
        when(payPalClient.listProducts(anyInt())).thenReturn(PayPalFixtures.read(
                "{\"products\":[{\"id\":\"PROD-1\",\"name\":\"Temple Recurring Donation\"}]}"));
        when(payPalClient.createPlan(anyMap())).thenReturn(PayPalFixtures.read("{\"id\":\"P-1\"}"));
        when(payPalClient.createSubscription(anyMap())).thenReturn(PayPalFixtures.read(
                "{\"id\":\"I-NEW1\",\"status\":\"APPROVAL_PENDING\",\"links\":[{\"rel\":\"approve\",\"href\":\"https://approve\"}]}"));

        mockMvc.perform(post("/api/paypal/create-subscription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": \"25\", \"donorName\": \"Arjun Rao\", \"frequency\": \"yearly\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.subscriptionId").value("I-NEW1"))
                .andExpect(jsonPath("$.approvalUrl").value("https://approve"))
                .andExpect(jsonPath("$.frequency").value("yearly"));

        ArgumentCaptor<Map<String, Object>> request = ArgumentCaptor.forClass(Map.class);
        verify(payPalClient).createSubscription(request.capture());
        Map<String, Object> context = (Map<String, Object>) request.getValue().get("application_context");
        assertEquals("https://temple.test/donation/recurring?status=success&type=subscription", context.get("return_url"));
        assertEquals("https://temple.test/donation/recurring?status=cancelled", context.get("cancel_url"));
    }

    @Test
    @DisplayName("Subscription can be fetched by path or query parameter")
    void testGetSubscription() throws Exception {
        when(payPalClient.getSubscription("I-GET1")).thenReturn(PayPalFixtures.subscription("I-GET1", "ACTIVE"));

        mockMvc.perform(get("/api/paypal/subscription/{id}", "I-GET1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"));

        mockMvc.perform(get("/api/paypal/get-subscription").param("subscriptionId", "I-GET1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("I-GET1"));

        mockMvc.perform(get("/api/paypal/get-subscription"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Subscription ID is required"));
    }

    @Test
    @DisplayName("Activate and cancel report what they did")
    void testActivateThenCancel() throws Exception {
        when(payPalClient.getSubscription("I-LC1")).thenReturn(PayPalFixtures.subscription("I-LC1", "ACTIVE"));

        mockMvc.perform(post("/api/paypal/activate-subscription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subscriptionId\": \"I-LC1\", \"donationData\": {\"donorName\": \"Arjun Rao\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Subscription activated"))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.donationId").exists());

        mockMvc.perform(post("/api/paypal/cancel-subscription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subscriptionId\": \"I-LC1\", \"reason\": \"Moving away\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Subscription cancelled"))
                .andExpect(jsonPath("$.data.status").value("CANCELLED"))
                .andExpect(jsonPath("$.data.donationsUpdated").value(1));

        verify(payPalClient).cancelSubscription("I-LC1", "Moving away");
    }

    @Test
    @DisplayName("Activate and cancel without a subscription id fail bean validation")
    void testSubscriptionId_Required() throws Exception {
        mockMvc.perform(post("/api/paypal/activate-subscription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"donationData\": {\"donorName\": \"Arjun Rao\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.subscriptionId").value("Subscription ID is required"));

        mockMvc.perform(post("/api/paypal/cancel-subscription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subscriptionId\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.subscriptionId").value("Subscription ID is required"));

        verify(payPalClient, never()).getSubscription(any());
        verify(payPalClient, never()).cancelSubscription(any(), any());
    }
}
