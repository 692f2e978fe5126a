package com.flagship.donation_pipeline.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 *
 * {@code partialSuccess} and {@code transactionId} are only set when a payment
 * was captured but could not be recorded.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    @Builder.Default
    boolean success = false;
    String error;
    String message;
    Map<String, Object> details;
    Boolean partialSuccess;
    String transactionId;
    String orderId;
    Instant timestamp;
}
