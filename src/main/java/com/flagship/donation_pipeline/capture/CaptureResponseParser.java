package com.flagship.donation_pipeline.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.exception.PaymentProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Turns a PayPal capture-order response into a {@link CaptureResult}.
 */
@Component
@Slf4j
public class CaptureResponseParser {

    static final String COMPLETED = "COMPLETED";

    private final Clock clock;

    public CaptureResponseParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws PaymentProviderException (400) when PayPal did not complete the capture,
     *         (502) when a completed capture carries no transaction id
     */
    public CaptureResult parse(JsonNode response) {
        String status = response.path("status").asText(null);
        if (!COMPLETED.equals(status)) {
            throw new PaymentProviderException("Payment capture failed. Status: " + status,
                    HttpStatus.BAD_REQUEST.value(), response.toString());
        }

        JsonNode purchaseUnit = response.path("purchase_units").path(0);
        JsonNode capture = purchaseUnit.path("payments").path("captures").path(0);
        String transactionId = capture.path("id").asText(null);
        if (transactionId == null || transactionId.isBlank()) {
            throw new PaymentProviderException("Capture response is missing the transaction id",
                    HttpStatus.BAD_GATEWAY.value(), response.toString());
        }

        String customId = capture.hasNonNull("custom_id")
                ? capture.get("custom_id").asText()
                : purchaseUnit.path("custom_id").asText(null);
        CorrelationBlob correlation = CorrelationBlob.parse(customId);

        BigDecimal gross = money(capture.path("amount").path("value"));
        BigDecimal fee = money(capture.path("seller_receivable_breakdown").path("paypal_fee").path("value"));

        JsonNode payer = response.path("payer");

        return CaptureResult.builder()
                .transactionId(transactionId)
                .orderId(response.path("id").asText(null))
                .status(status)
                .receiptNumber(correlation.getReceiptNumber() != null
                        ? correlation.getReceiptNumber()
                        : purchaseUnit.path("reference_id").asText(null))
                .grossAmount(gross)
                .paypalFee(fee)
                .netAmount(gross.subtract(fee))
                .currency(capture.path("amount").path("currency_code").asText("USD"))
                .payerId(payer.path("payer_id").asText(null))
                .payerEmail(payer.path("email_address").asText(null))
                .payerName(payerName(payer.path("name")))
                .purchaseDescription(purchaseUnit.path("description").asText(null))
                .capturedAt(timestamp(capture.path("create_time").asText(null)))
                .correlation(correlation)
                .build();
    }

    /**
     * Rebuilds the capture summary of a donation recorded earlier, for answering a
     * repeated capture without calling PayPal.
     */
    public CaptureResult fromRecorded(Donation donation) {
        Map<String, Object> metadata = donation.getMetadata() == null ? Map.of() : donation.getMetadata();
        BigDecimal gross = donation.getAmount().setScale(2, RoundingMode.HALF_UP);
        BigDecimal fee = metadata.get("paypal_fee") == null
                ? BigDecimal.ZERO.setScale(2)
                : new BigDecimal(metadata.get("paypal_fee").toString()).setScale(2, RoundingMode.HALF_UP);
        Object capturedAt = metadata.get("captured_at");

        return CaptureResult.builder()
                .transactionId(donation.getTransactionId())
                .orderId(donation.getProviderOrderId())
                .status(COMPLETED)
                .receiptNumber(donation.getReceiptNumber())
                .grossAmount(gross)
                .paypalFee(fee)
                .netAmount(gross.subtract(fee))
                .currency(donation.getCurrency())
                .payerId(metadata.get("paypal_payer_id") == null ? null : metadata.get("paypal_payer_id").toString())
                .payerEmail(donation.getDonorEmail())
                .payerName(donation.getDonorName())
                .capturedAt(timestamp(capturedAt == null ? null : capturedAt.toString()))
                .correlation(CorrelationBlob.empty())
                .build();
    }

    private static BigDecimal money(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return BigDecimal.ZERO.setScale(2);
        }
        try {
            return new BigDecimal(value.asText()).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            log.warn("Unparseable amount in capture response: {}", value.asText());
            return BigDecimal.ZERO.setScale(2);
        }
    }

    private static String payerName(JsonNode name) {
        if (name.isMissingNode() || name.isNull()) {
            return null;
        }
        String full = (name.path("given_name").asText("") + " " + name.path("surname").asText("")).trim();
        return full.isEmpty() ? null : full;
    }

    private Instant timestamp(String raw) {
        if (raw == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return clock.instant();
        }
    }
}
