package com.flagship.donation_pipeline.health;

import com.flagship.donation_pipeline.config.PayPalProperties;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and configuration check for the payment endpoints.
 * Unlike the Actuator health endpoint, this does not require authorization.
 * Besides a database ping it has no side effects; PayPal is not called.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final PayPalProperties payPalProperties;

    public HealthController(DataSource dataSource, PayPalProperties payPalProperties) {
        this.dataSource = dataSource;
        this.payPalProperties = payPalProperties;
    }

    @GetMapping("/api/paypal/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("status", "healthy");
        response.put("mode", payPalProperties.getMode());
        response.put("configured", payPalProperties.isConfigured());
        response.put("webhookConfigured", payPalProperties.isWebhookVerificationEnabled());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());

        if (!dbHealthy) {
            response.put("success", false);
            response.put("status", "unhealthy");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
