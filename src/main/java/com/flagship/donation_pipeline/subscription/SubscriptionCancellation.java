package com.flagship.donation_pipeline.subscription;

import lombok.Value;

@Value
public class SubscriptionCancellation {
    String subscriptionId;
    String status;
    /** Number of local donation rows moved to cancelled; -1 when the local update failed. */
    int donationsUpdated;
}
