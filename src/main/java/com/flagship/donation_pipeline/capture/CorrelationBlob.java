package com.flagship.donation_pipeline.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Correlation data carried through PayPal in the purchase unit's {@code custom_id}.
 *
 * PayPal limits custom_id to 127 characters, so the wire form uses short keys:
 * {@code {"pid":<pending id>,"rn":<receipt number>,"dt":<donation type>}}.
 * Orders created before the short form used {@code pendingId}, {@code receiptNumber}
 * and {@code donationType}; {@link #parse(String)} accepts both.
 */
@Value
public class CorrelationBlob {

    public static final int MAX_LENGTH = 127;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final CorrelationBlob EMPTY = new CorrelationBlob(null, null, null);

    String pendingId;
    String receiptNumber;
    String donationType;

    public static CorrelationBlob empty() {
        return EMPTY;
    }

    /**
     * Serializes with short keys. When the result would exceed {@link #MAX_LENGTH},
     * the donation type and then the receipt number are dropped; the pending id
     * alone is enough to find the full record.
     */
    public String serialize() {
        String full = write(pendingId, receiptNumber, donationType);
        if (full.length() <= MAX_LENGTH) {
            return full;
        }
        String withoutType = write(pendingId, receiptNumber, null);
        if (withoutType.length() <= MAX_LENGTH) {
            return withoutType;
        }
        String pendingOnly = write(pendingId, null, null);
        if (pendingOnly.length() <= MAX_LENGTH) {
            return pendingOnly;
        }
        return "{}";
    }

    /**
     * Parses a custom_id value. Blank, malformed or non-object input yields
     * {@link #empty()}: a missing blob only means less data to correlate with.
     */
    public static CorrelationBlob parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return EMPTY;
        }
        if (node == null || !node.isObject()) {
            return EMPTY;
        }
        return new CorrelationBlob(
                text(node, "pid", "pendingId"),
                text(node, "rn", "receiptNumber"),
                text(node, "dt", "donationType"));
    }

    public boolean isEmpty() {
        return pendingId == null && receiptNumber == null && donationType == null;
    }

    public Optional<UUID> pendingUuid() {
        if (pendingId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(pendingId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String write(String pid, String rn, String dt) {
        ObjectNode node = MAPPER.createObjectNode();
        if (pid != null) {
            node.put("pid", pid);
        }
        if (rn != null) {
            node.put("rn", rn);
        }
        if (dt != null) {
            node.put("dt", dt);
        }
        return node.toString();
    }

    private static String text(JsonNode node, String shortKey, String legacyKey) {
        JsonNode value = node.hasNonNull(shortKey) ? node.get(shortKey) : node.get(legacyKey);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
