package com.flagship.donation_pipeline.subscription;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SubscriptionCreated {
    @Builder.Default
    boolean success = true;
    String subscriptionId;
    String planId;
    String status;
    String approvalUrl;
    String frequency;
    BigDecimal amount;
}
