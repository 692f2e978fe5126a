package com.flagship.donation_pipeline.donation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of donation categories.
 *
 * The wire value is the lowercase name stored in the {@code donation_type}
 * column. A value outside this set is a data-integrity violation.
 */
public enum DonationType {
    GENERAL("general"),
    PUJA("puja"),
    ANNADAANA("annadaana"),
    RECURRING("recurring"),
    SERVICE("service"),
    SAI_AANGAN("sai_aangan"),
    SERVICE_TO_NEEDY("service_to_needy");

    private final String value;

    DonationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup by wire value.
     */
    public static Optional<DonationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
    }

    /**
     * Strict lookup: {@code null} or blank means {@link #GENERAL}, anything
     * else must be a member of the set.
     *
     * @throws InvalidDonationTypeException if the value is not a known type
     */
    public static DonationType require(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        return fromValue(value).orElseThrow(() -> new InvalidDonationTypeException(value, allowedValues()));
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(DonationType::getValue).collect(Collectors.toList());
    }
}
