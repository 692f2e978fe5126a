package com.flagship.donation_pipeline.donation;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link DonationType} by its lowercase wire value. Reading a value
 * outside the set fails loudly.
 */
@Converter
public class DonationTypeConverter implements AttributeConverter<DonationType, String> {

    @Override
    public String convertToDatabaseColumn(DonationType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public DonationType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : DonationType.require(dbData);
    }
}
