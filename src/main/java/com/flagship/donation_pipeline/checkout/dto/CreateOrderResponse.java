package com.flagship.donation_pipeline.checkout.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Response of the legacy order endpoint, which creates no pending donation.
 */
@Value
@Builder
public class CreateOrderResponse {
    @Builder.Default
    boolean success = true;
    String orderId;
    String approvalUrl;
    String receiptNumber;
    String status;
}
