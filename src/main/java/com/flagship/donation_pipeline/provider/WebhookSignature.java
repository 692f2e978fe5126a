package com.flagship.donation_pipeline.provider;

import lombok.Value;

/**
 * Transmission headers PayPal attaches to every webhook delivery.
 */
@Value
public class WebhookSignature {
    String authAlgo;
    String certUrl;
    String transmissionId;
    String transmissionSig;
    String transmissionTime;
}
