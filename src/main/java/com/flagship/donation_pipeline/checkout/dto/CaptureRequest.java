package com.flagship.donation_pipeline.checkout.dto;

import com.flagship.donation_pipeline.validation.DonationInput;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capture request. {@code donationData} is only sent by the legacy form, which
 * keeps donor fields in the browser across the PayPal redirect.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaptureRequest {
    @NotBlank(message = "Order ID is required")
    private String orderId;
    private DonationInput donationData;
}
