package com.flagship.donation_pipeline.checkout.dto;

import com.flagship.donation_pipeline.validation.DonationInput;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the activate and cancel subscription endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRequest {
    @NotBlank(message = "Subscription ID is required")
    private String subscriptionId;
    private String reason;
    private DonationInput donationData;
}
