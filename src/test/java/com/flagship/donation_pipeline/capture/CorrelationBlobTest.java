package com.flagship.donation_pipeline.capture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationBlobTest {

    @Test
    @DisplayName("Full blob fits in 127 characters with short keys")
    void testSerialize_FitsLimit() {
        String pendingId = UUID.randomUUID().toString();
        CorrelationBlob blob = new CorrelationBlob(pendingId, "TMP-20240101-ABC123", "service_to_needy");

        String serialized = blob.serialize();

        assertTrue(serialized.length() <= CorrelationBlob.MAX_LENGTH);
        assertTrue(serialized.contains("\"pid\":\"" + pendingId + "\""));
        assertTrue(serialized.contains("\"dt\":\"service_to_needy\""));
        assertEquals(blob, CorrelationBlob.parse(serialized));
    }

    @Test
    @DisplayName("Donation type and then receipt number are dropped when too long")
    void testSerialize_DropsOptionalFieldsWhenTooLong() {
        String pendingId = UUID.randomUUID().toString();
        String longReceipt = "R".repeat(70);

        CorrelationBlob parsed = CorrelationBlob.parse(
                new CorrelationBlob(pendingId, longReceipt, "general").serialize());
        assertEquals(pendingId, parsed.getPendingId());
        assertEquals(longReceipt, parsed.getReceiptNumber());
        assertNull(parsed.getDonationType());

        CorrelationBlob pendingOnly = CorrelationBlob.parse(
                new CorrelationBlob(pendingId, "R".repeat(100), "general").serialize());
        assertEquals(pendingId, pendingOnly.getPendingId());
        assertNull(pendingOnly.getReceiptNumber());
    }

    @Test
    @DisplayName("Legacy long keys are accepted")
    void testParse_LegacyKeys() {
        CorrelationBlob blob = CorrelationBlob.parse(
                "{\"pendingId\":\"abc\",\"receiptNumber\":\"TMP-1\",\"donationType\":\"puja\"}");

        assertEquals("abc", blob.getPendingId());
        assertEquals("TMP-1", blob.getReceiptNumber());
        assertEquals("puja", blob.getDonationType());
        assertTrue(blob.pendingUuid().isEmpty(), "non-UUID pending id should not parse");
    }

    @Test
    @DisplayName("Malformed or absent custom_id yields an empty blob")
    void testParse_MalformedInput() {
        assertTrue(CorrelationBlob.parse(null).isEmpty());
        assertTrue(CorrelationBlob.parse("   ").isEmpty());
        assertTrue(CorrelationBlob.parse("{not json").isEmpty());
        assertTrue(CorrelationBlob.parse("[1,2]").isEmpty());
        assertTrue(CorrelationBlob.parse("\"plain\"").isEmpty());
    }
}
