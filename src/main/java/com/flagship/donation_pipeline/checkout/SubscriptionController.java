package com.flagship.donation_pipeline.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.checkout.dto.DataResponse;
import com.flagship.donation_pipeline.checkout.dto.SubscriptionRequest;
import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.subscription.SubscriptionActivation;
import com.flagship.donation_pipeline.subscription.SubscriptionCancellation;
import com.flagship.donation_pipeline.subscription.SubscriptionCreated;
import com.flagship.donation_pipeline.subscription.SubscriptionService;
import com.flagship.donation_pipeline.validation.DonationInput;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for recurring donations.
 */
@RestController
@RequestMapping("/api/paypal")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final DonationProperties donationProperties;

    @PostMapping("/create-subscription")
    public ResponseEntity<SubscriptionCreated> create(@RequestBody DonationInput request) {
        String frontendUrl = donationProperties.getFrontendUrl();
        String returnUrl = orDefault(request.getReturnUrl(),
                frontendUrl + "/donation/recurring?status=success&type=subscription");
        String cancelUrl = orDefault(request.getCancelUrl(), frontendUrl + "/donation/recurring?status=cancelled");
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subscriptionService.createSubscription(request, returnUrl, cancelUrl));
    }

    @GetMapping("/subscription/{subscriptionId}")
    public ResponseEntity<DataResponse<JsonNode>> get(@PathVariable("subscriptionId") String subscriptionId) {
        return ResponseEntity.ok(DataResponse.of(subscriptionService.getSubscription(subscriptionId)));
    }

    @GetMapping("/get-subscription")
    public ResponseEntity<DataResponse<JsonNode>> getByQuery(
            @RequestParam(value = "subscriptionId", required = false) String subscriptionId) {
        return ResponseEntity.ok(DataResponse.of(subscriptionService.getSubscription(subscriptionId)));
    }

    @PostMapping("/activate-subscription")
    public ResponseEntity<DataResponse<SubscriptionActivation>> activate(@Valid @RequestBody SubscriptionRequest request) {
        SubscriptionActivation activation =
                subscriptionService.activateSubscription(request.getSubscriptionId(), request.getDonationData());
        return ResponseEntity.ok(DataResponse.of("Subscription activated", activation));
    }

    @PostMapping("/cancel-subscription")
    public ResponseEntity<DataResponse<SubscriptionCancellation>> cancel(@Valid @RequestBody SubscriptionRequest request) {
        SubscriptionCancellation cancellation =
                subscriptionService.cancelSubscription(request.getSubscriptionId(), request.getReason());
        return ResponseEntity.ok(DataResponse.of("Subscription cancelled", cancellation));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
