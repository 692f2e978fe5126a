package com.flagship.donation_pipeline.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Subscription custom_id: {@code {"f":<frequency>,"a":<amount>}}.
 * Lets an activation without form data still record frequency and amount.
 */
@Value
public class SubscriptionCorrelation {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SubscriptionCorrelation EMPTY = new SubscriptionCorrelation(null, null);

    String frequency;
    String amount;

    public String serialize() {
        ObjectNode node = MAPPER.createObjectNode();
        if (frequency != null) {
            node.put("f", frequency);
        }
        if (amount != null) {
            node.put("a", amount);
        }
        return node.toString();
    }

    public static SubscriptionCorrelation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (node == null || !node.isObject()) {
                return EMPTY;
            }
            return new SubscriptionCorrelation(
                    node.hasNonNull("f") ? node.get("f").asText() : null,
                    node.hasNonNull("a") ? node.get("a").asText() : null);
        } catch (JsonProcessingException e) {
            return EMPTY;
        }
    }
}
