package com.flagship.donation_pipeline.subscription;

import lombok.Value;

import java.util.UUID;

/**
 * Provider-side subscription state and the local donation row that mirrors it.
 */
@Value
public class SubscriptionActivation {
    String subscriptionId;
    String status;
    String planId;
    UUID donationId;
}
