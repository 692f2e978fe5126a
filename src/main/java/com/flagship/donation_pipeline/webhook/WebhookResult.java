package com.flagship.donation_pipeline.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * What the dispatcher did with one webhook event.
 *
 * {@code correlatingId} is the order, transaction or subscription id the event
 * refers to, depending on the event type.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResult {
    @Builder.Default
    boolean success = true;
    boolean processed;
    String action;
    String correlatingId;
    String eventType;
    String reason;

    static WebhookResult handled(String eventType, String action, String correlatingId) {
        return WebhookResult.builder()
                .processed(true)
                .action(action)
                .correlatingId(correlatingId)
                .eventType(eventType)
                .build();
    }

    static WebhookResult unhandled(String eventType) {
        return WebhookResult.builder()
                .processed(false)
                .reason("unhandled_event_type")
                .eventType(eventType)
                .build();
    }
}
