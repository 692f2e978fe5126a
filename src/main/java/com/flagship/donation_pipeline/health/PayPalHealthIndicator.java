package com.flagship.donation_pipeline.health;

import com.flagship.donation_pipeline.config.PayPalProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health for PayPal configuration. Down when credentials are missing;
 * an unverified webhook setup is reported as a detail, not as down.
 */
@Component("paypalHealth")
public class PayPalHealthIndicator implements HealthIndicator {

    private final PayPalProperties properties;

    public PayPalHealthIndicator(PayPalProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        Health.Builder builder = properties.isConfigured() ? Health.up() : Health.down();
        return builder
                .withDetail("mode", properties.getMode())
                .withDetail("baseUrl", properties.resolveBaseUrl())
                .withDetail("credentialsConfigured", properties.isConfigured())
                .withDetail("webhookVerification", properties.isWebhookVerificationEnabled() ? "enabled" : "disabled")
                .build();
    }
}
