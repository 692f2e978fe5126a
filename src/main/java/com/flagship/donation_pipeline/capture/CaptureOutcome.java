package com.flagship.donation_pipeline.capture;

import com.flagship.donation_pipeline.donation.Donation;
import lombok.Value;

/**
 * Result of a capture: the recorded donation and the PayPal capture it came from.
 */
@Value
public class CaptureOutcome {
    Donation donation;
    CaptureResult capture;
    /** false when the transaction had already been recorded by an earlier capture. */
    boolean newlyRecorded;
}
