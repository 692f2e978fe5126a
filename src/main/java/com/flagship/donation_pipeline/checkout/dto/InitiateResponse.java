package com.flagship.donation_pipeline.checkout.dto;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class InitiateResponse {
    @Builder.Default
    boolean success = true;
    UUID pendingId;
    String orderId;
    String approvalUrl;
    String receiptNumber;
}
