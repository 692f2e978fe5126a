package com.flagship.donation_pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * PayPal credentials and endpoints, bound from {@code paypal.*}.
 */
@ConfigurationProperties(prefix = "paypal")
@Getter
@Setter
public class PayPalProperties {

    static final String WEBHOOK_ID_PLACEHOLDER = "your_webhook_id_here";

    private static final String SANDBOX_URL = "https://api-m.sandbox.paypal.com";
    private static final String LIVE_URL = "https://api-m.paypal.com";

    private String clientId;
    private String clientSecret;

    /**
     * {@code sandbox} or {@code live}.
     */
    private String mode = "sandbox";

    private String webhookId;

    /**
     * Overrides the URL derived from {@link #mode}. Used by tests and proxies.
     */
    private String baseUrl;

    private String brandName = "Temple Donation";

    private String productName = "Temple Recurring Donation";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    private Duration productCacheTtl = Duration.ofHours(24);

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        return "live".equalsIgnoreCase(mode) ? LIVE_URL : SANDBOX_URL;
    }

    public boolean isConfigured() {
        return hasText(clientId) && hasText(clientSecret);
    }

    public boolean isWebhookVerificationEnabled() {
        return hasText(webhookId) && !WEBHOOK_ID_PLACEHOLDER.equals(webhookId);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
