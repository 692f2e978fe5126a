package com.flagship.donation_pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Application settings for the donation endpoints, bound from {@code donations.*}.
 */
@ConfigurationProperties(prefix = "donations")
@Getter
@Setter
public class DonationProperties {

    private String frontendUrl = "http://localhost:8080";

    private Duration pendingExpiry = Duration.ofHours(24);

    private final Errors errors = new Errors();

    private final RateLimit rateLimit = new RateLimit();

    private final Receipts receipts = new Receipts();

    @Getter
    @Setter
    public static class Errors {
        /**
         * Include exception details and raw provider bodies in error responses.
         * Must stay off in production.
         */
        private boolean includeDetails = false;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        private long capacity = 10;
        private Duration window = Duration.ofMinutes(1);
        private long maxTrackedClients = 10_000;
    }

    @Getter
    @Setter
    public static class Receipts {
        private String from = "noreply@temple.org";
        private String subject = "Thank you for your donation";
    }
}
