package com.flagship.donation_pipeline.pending;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PendingDonationStatusConverter implements AttributeConverter<PendingDonationStatus, String> {

    @Override
    public String convertToDatabaseColumn(PendingDonationStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public PendingDonationStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PendingDonationStatus.fromValue(dbData);
    }
}
