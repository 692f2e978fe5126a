package com.flagship.donation_pipeline.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.donation_pipeline.provider.WebhookSignature;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * PayPal webhook endpoint. Not rate limited.
 */
@RestController
@RequestMapping("/api/paypal")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookDispatcher dispatcher;

    @PostMapping("/webhook")
    public ResponseEntity<WebhookResult> receive(
            @RequestBody JsonNode event,
            @RequestHeader(value = "paypal-auth-algo", required = false) String authAlgo,
            @RequestHeader(value = "paypal-cert-url", required = false) String certUrl,
            @RequestHeader(value = "paypal-transmission-id", required = false) String transmissionId,
            @RequestHeader(value = "paypal-transmission-sig", required = false) String transmissionSig,
            @RequestHeader(value = "paypal-transmission-time", required = false) String transmissionTime) {

        WebhookSignature signature = new WebhookSignature(authAlgo, certUrl, transmissionId, transmissionSig, transmissionTime);
        return ResponseEntity.ok(dispatcher.receive(event, signature));
    }
}
