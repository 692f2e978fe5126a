package com.flagship.donation_pipeline.validation;

import com.flagship.donation_pipeline.donation.DonationType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Donor fields after sanitization. Safe to persist and to forward to PayPal.
 */
@Value
@Builder(toBuilder = true)
public class SanitizedDonation {
    BigDecimal amount;
    String donorName;
    String donorEmail;
    String donorPhone;
    String campaignId;
    String campaignName;
    DonationType donationType;
    String message;
    String currency;
    String frequency;
    String occasion;
    Map<String, Object> metadata;
}
