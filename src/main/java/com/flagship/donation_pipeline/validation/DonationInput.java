package com.flagship.donation_pipeline.validation;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Raw donor-supplied fields, as posted by the donation form.
 *
 * Nothing here is trusted: every field passes through {@link DonationSanitizer}
 * before it reaches the provider or the database. Aliases accept the older
 * field names the legacy form still sends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonationInput {

    private String amount;

    @JsonAlias("name")
    private String donorName;

    @JsonAlias("email")
    private String donorEmail;

    @JsonAlias("phone")
    private String donorPhone;

    private String campaignId;

    @JsonAlias("campaign_name")
    private String campaignName;

    @JsonAlias("donation_type")
    private String donationType;

    private String message;

    private String currency;

    private String frequency;

    private String occasion;

    private Map<String, Object> metadata;

    /** Where PayPal sends the donor after approval. Defaults to the donation page. */
    private String returnUrl;

    /** Where PayPal sends the donor after cancelling. Defaults to the donation page. */
    private String cancelUrl;
}
