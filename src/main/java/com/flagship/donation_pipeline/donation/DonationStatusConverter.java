package com.flagship.donation_pipeline.donation;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link DonationStatus} as its lowercase value ({@code completed},
 * {@code cancelled}, ...), the form other readers of {@code donations} expect.
 */
@Converter
public class DonationStatusConverter implements AttributeConverter<DonationStatus, String> {

    @Override
    public String convertToDatabaseColumn(DonationStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public DonationStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : DonationStatus.fromValue(dbData);
    }
}
