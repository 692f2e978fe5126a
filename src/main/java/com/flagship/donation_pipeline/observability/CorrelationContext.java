package com.flagship.donation_pipeline.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys that tie log lines of one request together.
 *
 * The correlation ID comes from the X-Correlation-ID header (or is generated);
 * the order and pending IDs are added while a capture runs.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ORDER_ID_MDC_KEY = "orderId";
    public static final String PENDING_ID_MDC_KEY = "pendingId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Removes every key this class defines from the current thread's MDC.
     */
    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ORDER_ID_MDC_KEY);
        MDC.remove(PENDING_ID_MDC_KEY);
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
