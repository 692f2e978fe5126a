package com.flagship.donation_pipeline.donation;

import lombok.Value;

/**
 * Result of {@link DonationRecorder#recordOnce(Donation)}.
 */
@Value
public class RecordedDonation {
    Donation donation;
    /** false when the transaction had already been recorded. */
    boolean created;
}
