package com.flagship.donation_pipeline.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Correlation filter tests.
 *
 * These tests verify that:
 * - A caller-supplied X-Correlation-ID is logged under MDC and echoed back
 * - A missing header gets a generated id
 * - Correlation, order and pending MDC keys never leak past the request
 */
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Header value is placed in MDC for the request and echoed on the response")
    void testFilter_UsesHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/paypal/capture");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response,
                (req, res) -> seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY)));

        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("Missing header gets a generated id")
    void testFilter_GeneratesId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/paypal/health"), response, (req, res) -> { });

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    @DisplayName("Capture MDC keys are cleared when the request ends")
    void testFilter_ClearsMdc() throws Exception {
        filter.doFilter(new MockHttpServletRequest("POST", "/api/paypal/capture"), new MockHttpServletResponse(),
                (req, res) -> {
                    MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, "ORDER-1");
                    MDC.put(CorrelationContext.PENDING_ID_MDC_KEY, "pending-1");
                });

        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.ORDER_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.PENDING_ID_MDC_KEY));
    }
}
