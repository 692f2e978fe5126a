package com.flagship.donation_pipeline.checkout;

import com.flagship.donation_pipeline.checkout.dto.CaptureRequest;
import com.flagship.donation_pipeline.checkout.dto.CaptureResponse;
import com.flagship.donation_pipeline.checkout.dto.CreateOrderResponse;
import com.flagship.donation_pipeline.checkout.dto.DonationStatusResponse;
import com.flagship.donation_pipeline.checkout.dto.InitiateResponse;
import com.flagship.donation_pipeline.validation.DonationInput;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST endpoints for one-time donations.
 *
 * Key features:
 * - POST /initiate writes a pending donation before redirecting to PayPal
 * - POST /capture records exactly one donation per PayPal transaction
 * - A captured-but-unrecorded payment answers 500 with {@code partialSuccess}
 *   and the transaction id
 */
@RestController
@RequestMapping("/api/paypal")
@RequiredArgsConstructor
@Slf4j
public class CheckoutController {

    private final CheckoutService checkoutService;

    @PostMapping("/initiate")
    public ResponseEntity<InitiateResponse> initiate(@RequestBody DonationInput request) {
        log.info("Received checkout request: amount={}, campaign={}", request.getAmount(), request.getCampaignName());
        return ResponseEntity.status(HttpStatus.CREATED).body(checkoutService.initiate(request));
    }

    @PostMapping("/create-order")
    public ResponseEntity<CreateOrderResponse> createOrder(@RequestBody DonationInput request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(checkoutService.createOrder(request));
    }

    /**
     * {@code /capture-order} is the legacy name; both accept {@code donationData}.
     */
    @PostMapping({"/capture", "/capture-order"})
    public ResponseEntity<CaptureResponse> capture(@Valid @RequestBody CaptureRequest request) {
        return ResponseEntity.ok(checkoutService.capture(request));
    }

    @GetMapping("/status/{pendingId}")
    public ResponseEntity<DonationStatusResponse> status(@PathVariable("pendingId") UUID pendingId) {
        return ResponseEntity.ok(checkoutService.status(pendingId));
    }
}
