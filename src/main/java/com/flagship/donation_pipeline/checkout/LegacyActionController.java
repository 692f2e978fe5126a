package com.flagship.donation_pipeline.checkout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flagship.donation_pipeline.checkout.dto.CaptureRequest;
import com.flagship.donation_pipeline.checkout.dto.SubscriptionRequest;
import com.flagship.donation_pipeline.exception.ApiError;
import com.flagship.donation_pipeline.health.HealthController;
import com.flagship.donation_pipeline.validation.DonationInput;
import com.flagship.donation_pipeline.webhook.WebhookController;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Single-URL dispatcher kept for clients that still call {@code /api/paypal?action=...}.
 * Each action delegates to the same handler as its named route.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class LegacyActionController {

    static final List<String> VALID_ACTIONS = List.of(
            "initiate", "create-order", "capture-order", "create-subscription",
            "activate-subscription", "get-subscription", "cancel-subscription", "webhook", "health");

    private final CheckoutController checkoutController;
    private final SubscriptionController subscriptionController;
    private final WebhookController webhookController;
    private final HealthController healthController;
    private final ObjectMapper objectMapper;

    @RequestMapping(value = "/api/paypal", params = "action")
    public ResponseEntity<?> dispatch(@RequestParam("action") String action,
                                      @RequestParam(value = "subscriptionId", required = false) String subscriptionId,
                                      @RequestBody(required = false) JsonNode body,
                                      HttpServletRequest request) {
        boolean post = "POST".equalsIgnoreCase(request.getMethod());
        JsonNode payload = body != null ? body : JsonNodeFactory.instance.objectNode();
        log.debug("Legacy action: action={}, method={}", action, request.getMethod());

        return switch (action) {
            case "initiate" -> post ? checkoutController.initiate(read(payload, DonationInput.class)) : notAllowed();
            case "create-order" -> post ? checkoutController.createOrder(read(payload, DonationInput.class)) : notAllowed();
            case "capture-order" -> post ? checkoutController.capture(read(payload, CaptureRequest.class)) : notAllowed();
            case "create-subscription" ->
                    post ? subscriptionController.create(read(payload, DonationInput.class)) : notAllowed();
            case "activate-subscription" ->
                    post ? subscriptionController.activate(read(payload, SubscriptionRequest.class)) : notAllowed();
            case "cancel-subscription" ->
                    post ? subscriptionController.cancel(read(payload, SubscriptionRequest.class)) : notAllowed();
            case "get-subscription" -> subscriptionController.getByQuery(subscriptionId);
            case "webhook" -> post
                    ? webhookController.receive(payload,
                            request.getHeader("paypal-auth-algo"),
                            request.getHeader("paypal-cert-url"),
                            request.getHeader("paypal-transmission-id"),
                            request.getHeader("paypal-transmission-sig"),
                            request.getHeader("paypal-transmission-time"))
                    : notAllowed();
            case "health" -> healthController.health();
            default -> invalidAction(action);
        };
    }

    private <T> T read(JsonNode payload, Class<T> type) {
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed request body", e);
        }
    }

    private static ResponseEntity<ApiError> notAllowed() {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ApiError.builder()
                .error("Method Not Allowed")
                .message("Method not allowed")
                .timestamp(Instant.now())
                .build());
    }

    private static ResponseEntity<ApiError> invalidAction(String action) {
        log.warn("Unknown legacy action: {}", action);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .error("Invalid Request")
                .message("Invalid action")
                .details(Map.of("validActions", VALID_ACTIONS))
                .timestamp(Instant.now())
                .build());
    }
}
