package com.flagship.donation_pipeline.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.donation_pipeline.config.DonationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rate limiting filter tests.
 *
 * These tests verify that:
 * - Each client address gets its own bucket
 * - Forwarded headers supplied by the client never select the bucket
 * - Webhook and health traffic is never limited
 */
class RateLimitingFilterTest {

    private DonationProperties properties;
    private SimpleMeterRegistry registry;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new DonationProperties();
        properties.getRateLimit().setCapacity(2);
        properties.getRateLimit().setWindow(Duration.ofMinutes(1));
        registry = new SimpleMeterRegistry();
        filter = new RateLimitingFilter(properties, new ObjectMapper().findAndRegisterModules(),
                new DonationMetrics(registry));
    }

    private MockHttpServletResponse send(String path, String clientIp) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setRemoteAddr(clientIp);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    @DisplayName("Requests beyond the bucket capacity get 429 with Retry-After")
    void testRateLimit_Exceeded() throws Exception {
        assertEquals(200, send("/api/paypal/initiate", "203.0.113.5").getStatus());
        assertEquals(200, send("/api/paypal/initiate", "203.0.113.5").getStatus());

        MockHttpServletResponse limited = send("/api/paypal/capture", "203.0.113.5");

        assertEquals(429, limited.getStatus());
        assertEquals("60", limited.getHeader("Retry-After"));
        assertTrue(limited.getContentAsString().contains("\"error\":\"RATE_LIMITED\""));
        assertEquals(1.0, registry.counter("donation.rate_limited").count());
    }

    @Test
    @DisplayName("Buckets are per client address")
    void testRateLimit_PerClient() throws Exception {
        send("/api/paypal/initiate", "203.0.113.5");
        send("/api/paypal/initiate", "203.0.113.5");

        assertEquals(429, send("/api/paypal/initiate", "203.0.113.5").getStatus());
        assertEquals(200, send("/api/paypal/initiate", "198.51.100.7").getStatus());
    }

    @Test
    @DisplayName("Rotating X-Forwarded-For does not open a fresh bucket")
    void testRateLimit_ForwardedHeaderIgnored() throws Exception {
        send("/api/paypal/initiate", "203.0.113.5");
        send("/api/paypal/initiate", "203.0.113.5");

        for (int i = 0; i < 3; i++) {
            MockHttpServletRequest forwarded = new MockHttpServletRequest("POST", "/api/paypal/initiate");
            forwarded.setRemoteAddr("203.0.113.5");
            forwarded.addHeader("X-Forwarded-For", "192.0.2." + i);
            MockHttpServletResponse response = new MockHttpServletResponse();
            filter.doFilter(forwarded, response, new MockFilterChain());
            assertEquals(429, response.getStatus());
        }
        assertEquals(3.0, registry.counter("donation.rate_limited").count());
    }

    @Test
    @DisplayName("Webhook, health and non-payment paths are never limited")
    void testRateLimit_ExcludedPaths() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertEquals(200, send("/api/paypal/webhook", "203.0.113.9").getStatus());
            assertEquals(200, send("/api/paypal/health", "203.0.113.9").getStatus());
            assertEquals(200, send("/actuator/health", "203.0.113.9").getStatus());
        }

        MockHttpServletRequest legacyWebhook = new MockHttpServletRequest("POST", "/api/paypal");
        legacyWebhook.setParameter("action", "webhook");
        legacyWebhook.setRemoteAddr("203.0.113.9");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(legacyWebhook, response, new MockFilterChain());
        assertEquals(200, response.getStatus());
    }

    @Test
    @DisplayName("Disabled limiter lets everything through")
    void testRateLimit_Disabled() throws Exception {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 5; i++) {
            assertEquals(200, send("/api/paypal/initiate", "203.0.113.5").getStatus());
        }
    }
}
