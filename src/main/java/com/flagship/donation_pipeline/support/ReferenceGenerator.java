package com.flagship.donation_pipeline.support;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates PayPal request ids (idempotency keys) and donor receipt numbers.
 */
@Component
public class ReferenceGenerator {

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ReferenceGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Idempotency key for a single mutating provider call: {@code <epochMillis>-<24 hex>}.
     */
    public String newRequestId() {
        return clock.millis() + "-" + randomHex(12);
    }

    /**
     * Receipt number shown to the donor: {@code DON-<base36 time>-<8 HEX>}.
     */
    public String newReceiptNumber() {
        String timestamp = Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT);
        return "DON-" + timestamp + "-" + randomHex(4).toUpperCase(Locale.ROOT);
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
