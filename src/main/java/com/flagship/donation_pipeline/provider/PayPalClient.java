package com.flagship.donation_pipeline.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.donation_pipeline.cache.TtlCache;
import com.flagship.donation_pipeline.config.PayPalProperties;
import com.flagship.donation_pipeline.exception.PaymentConfigurationException;
import com.flagship.donation_pipeline.exception.PaymentProviderException;
import com.flagship.donation_pipeline.exception.ProviderAuthException;
import com.flagship.donation_pipeline.support.ReferenceGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin request layer over the PayPal REST API.
 *
 * Key behavior:
 * - One cached bearer token, refreshed when it is within 60 seconds of expiry
 * - A fresh PayPal-Request-Id on every mutating call, so a client-side retry
 *   of the same logical operation cannot double-create at PayPal
 * - Non-2xx responses become {@link PaymentProviderException} with the HTTP status
 * - No retries: a failed or timed-out call fails the current operation
 */
@Component
@Slf4j
public class PayPalClient {

    static final String TOKEN_CACHE_KEY = "paypal:access-token";
    static final Duration TOKEN_REFRESH_MARGIN = Duration.ofSeconds(60);

    private static final String REQUEST_ID_HEADER = "PayPal-Request-Id";

    private final RestTemplate restTemplate;
    private final PayPalProperties properties;
    private final TtlCache<String, String> cache;
    private final ReferenceGenerator references;
    private final ObjectMapper objectMapper;

    public PayPalClient(RestTemplate restTemplate,
                        PayPalProperties properties,
                        TtlCache<String, String> cache,
                        ReferenceGenerator references,
                        ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.cache = cache;
        this.references = references;
        this.objectMapper = objectMapper;
    }

    // ==================== Orders ====================

    public JsonNode createOrder(Map<String, Object> order) {
        return send(HttpMethod.POST, "/v2/checkout/orders", order);
    }

    public JsonNode captureOrder(String orderId) {
        return send(HttpMethod.POST, "/v2/checkout/orders/{id}/capture", null, orderId);
    }

    // ==================== Catalog & billing ====================

    public JsonNode listProducts(int pageSize) {
        return send(HttpMethod.GET, "/v1/catalogs/products?page_size={size}", null, pageSize);
    }

    public JsonNode createProduct(Map<String, Object> product) {
        return send(HttpMethod.POST, "/v1/catalogs/products", product);
    }

    public JsonNode createPlan(Map<String, Object> plan) {
        return send(HttpMethod.POST, "/v1/billing/plans", plan);
    }

    public JsonNode createSubscription(Map<String, Object> subscription) {
        return send(HttpMethod.POST, "/v1/billing/subscriptions", subscription);
    }

    public JsonNode getSubscription(String subscriptionId) {
        return send(HttpMethod.GET, "/v1/billing/subscriptions/{id}", null, subscriptionId);
    }

    public void cancelSubscription(String subscriptionId, String reason) {
        send(HttpMethod.POST, "/v1/billing/subscriptions/{id}/cancel", Map.of("reason", reason), subscriptionId);
    }

    // ==================== Webhooks ====================

    /**
     * Asks PayPal whether a webhook delivery carries a valid signature for the
     * configured webhook id.
     */
    public boolean verifyWebhookSignature(WebhookSignature signature, JsonNode event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("auth_algo", signature.getAuthAlgo());
        body.put("cert_url", signature.getCertUrl());
        body.put("transmission_id", signature.getTransmissionId());
        body.put("transmission_sig", signature.getTransmissionSig());
        body.put("transmission_time", signature.getTransmissionTime());
        body.put("webhook_id", properties.getWebhookId());
        body.put("webhook_event", event);

        JsonNode result = send(HttpMethod.POST, "/v1/notifications/verify-webhook-signature", body);
        return "SUCCESS".equals(result.path("verification_status").asText());
    }

    // ==================== Authentication ====================

    /**
     * Returns the cached bearer token or fetches a new one.
     *
     * @throws ProviderAuthException if PayPal rejects the credentials or cannot be reached
     */
    public String accessToken() {
        requireConfigured();

        var cached = cache.get(TOKEN_CACHE_KEY);
        if (cached.isPresent()) {
            return cached.get();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(properties.getClientId(), properties.getClientSecret());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        String body;
        try {
            body = restTemplate.exchange(properties.resolveBaseUrl() + "/v1/oauth2/token",
                    HttpMethod.POST, new HttpEntity<>(form, headers), String.class).getBody();
        } catch (RestClientResponseException e) {
            log.error("PayPal auth error: status={}, body={}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new ProviderAuthException(e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            log.error("PayPal auth endpoint unreachable: {}", e.getMessage());
            throw new ProviderAuthException(e);
        }

        JsonNode token = parse(body);
        String accessToken = token.path("access_token").asText(null);
        if (accessToken == null) {
            throw new ProviderAuthException(body);
        }

        Duration lifetime = Duration.ofSeconds(token.path("expires_in").asLong(0));
        cache.put(TOKEN_CACHE_KEY, accessToken, lifetime.minus(TOKEN_REFRESH_MARGIN));
        log.debug("Fetched PayPal access token, expires in {}s", lifetime.toSeconds());
        return accessToken;
    }

    public void requireConfigured() {
        if (!properties.isConfigured()) {
            throw new PaymentConfigurationException("PayPal client id and secret are not configured");
        }
    }

    // ==================== Transport ====================

    private JsonNode send(HttpMethod method, String path, Object body, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("Prefer", "return=representation");
        if (!HttpMethod.GET.equals(method)) {
            headers.set(REQUEST_ID_HEADER, references.newRequestId());
        }

        String url = properties.resolveBaseUrl() + path;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, method, new HttpEntity<>(body, headers), String.class, uriVariables);
            return parse(response.getBody());
        } catch (RestClientResponseException e) {
            String rawBody = e.getResponseBodyAsString();
            log.error("PayPal API error [{} {}]: status={}, body={}",
                    method, path, e.getStatusCode().value(), rawBody);
            throw new PaymentProviderException(extractMessage(rawBody), e.getStatusCode().value(), rawBody, e);
        } catch (ResourceAccessException e) {
            log.error("PayPal API unreachable [{} {}]: {}", method, path, e.getMessage());
            throw new PaymentProviderException("PayPal is unreachable", 503, null, e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PaymentProviderException("Unreadable PayPal response", 502, body, e);
        }
    }

    private String extractMessage(String rawBody) {
        JsonNode error;
        try {
            error = rawBody == null || rawBody.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            return "PayPal API request failed";
        }
        String description = error.path("details").path(0).path("description").asText("");
        if (!description.isEmpty()) {
            return description;
        }
        String message = error.path("message").asText("");
        return message.isEmpty() ? "PayPal API request failed" : message;
    }
}
