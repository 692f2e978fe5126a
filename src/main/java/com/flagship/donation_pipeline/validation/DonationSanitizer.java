package com.flagship.donation_pipeline.validation;

import com.flagship.donation_pipeline.donation.DonationType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes and bounds-checks donor input.
 *
 * Malformed input never throws: it degrades to a safe default or becomes an
 * error entry in the returned {@link SanitizationOutcome}.
 *
 * The text filter is defense-in-depth against markup and script injection in
 * stored fields. It is not an HTML sanitizer and output must still be escaped
 * wherever it is rendered.
 */
@Component
public class DonationSanitizer {

    static final BigDecimal MIN_AMOUNT = BigDecimal.ONE;
    static final BigDecimal MAX_AMOUNT = new BigDecimal("100000");

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[<>\"'\\\\]");
    private static final Pattern SCRIPT_SCHEME = Pattern.compile("(?i)javascript:");
    private static final Pattern EVENT_HANDLER = Pattern.compile("(?i)on\\w+=");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final List<String> TEXT_METADATA_FIELDS = List.of(
            "puja_date", "puja_type", "family_members", "gotra", "nakshatra", "preferred_date", "occasion");

    // Ordered: longer phrases must be tried before the words they contain.
    private static final Map<String, DonationType> CAMPAIGN_KEYWORDS;

    static {
        Map<String, DonationType> keywords = new LinkedHashMap<>();
        keywords.put("sai aangan fundraising", DonationType.SAI_AANGAN);
        keywords.put("sai aangan", DonationType.SAI_AANGAN);
        keywords.put("service to needy", DonationType.SERVICE_TO_NEEDY);
        keywords.put("needy", DonationType.SERVICE_TO_NEEDY);
        keywords.put("puja", DonationType.PUJA);
        keywords.put("annadaana", DonationType.ANNADAANA);
        keywords.put("food", DonationType.ANNADAANA);
        keywords.put("recurring", DonationType.RECURRING);
        keywords.put("monthly", DonationType.RECURRING);
        keywords.put("service", DonationType.SERVICE);
        CAMPAIGN_KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    public AmountValidation validateAmount(String rawAmount) {
        BigDecimal amount;
        try {
            amount = rawAmount == null ? null : new BigDecimal(rawAmount.trim());
        } catch (NumberFormatException e) {
            amount = null;
        }

        if (amount == null || amount.signum() <= 0) {
            return AmountValidation.rejected("Amount must be a positive number");
        }
        if (amount.compareTo(MIN_AMOUNT) < 0) {
            return AmountValidation.rejected("Minimum donation is $1");
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            return AmountValidation.rejected("Amount exceeds maximum limit of $100,000");
        }
        return AmountValidation.accepted(amount.setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * Strips markup characters, script schemes, inline handlers and control
     * characters, then trims and truncates. {@code null} becomes empty.
     */
    public String sanitizeText(String input, int maxLength) {
        if (input == null) {
            return "";
        }
        String cleaned = UNSAFE_CHARACTERS.matcher(input).replaceAll("");
        cleaned = SCRIPT_SCHEME.matcher(cleaned).replaceAll("");
        cleaned = EVENT_HANDLER.matcher(cleaned).replaceAll("");
        cleaned = CONTROL_CHARACTERS.matcher(cleaned).replaceAll("").trim();
        return cleaned.length() > maxLength ? cleaned.substring(0, maxLength) : cleaned;
    }

    /**
     * @return the lowercased address, or {@code null} when absent or malformed
     */
    public String validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        String sanitized = sanitizeText(email, 254).toLowerCase(Locale.ROOT);
        return EMAIL.matcher(sanitized).matches() ? sanitized : null;
    }

    public DonationType mapToDonationType(String campaignName, String explicitType) {
        if (explicitType != null) {
            var explicit = DonationType.fromValue(explicitType);
            if (explicit.isPresent()) {
                return explicit.get();
            }
        }
        if (campaignName != null) {
            String lowerName = campaignName.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, DonationType> keyword : CAMPAIGN_KEYWORDS.entrySet()) {
                if (lowerName.contains(keyword.getKey())) {
                    return keyword.getValue();
                }
            }
        }
        return DonationType.GENERAL;
    }

    /**
     * Sanitizes a donation form.
     *
     * @param input raw form fields
     * @param donorIdentityRequired when true, donor name and a valid email are mandatory
     */
    public SanitizationOutcome sanitize(DonationInput input, boolean donorIdentityRequired) {
        List<String> errors = new ArrayList<>();

        AmountValidation amount = validateAmount(input.getAmount());
        if (!amount.isValid()) {
            errors.add(amount.getError());
        }

        String email = validateEmail(input.getDonorEmail());
        if (donorIdentityRequired) {
            if (isBlank(input.getDonorName())) {
                errors.add("Donor name is required");
            }
            if (isBlank(input.getDonorEmail())) {
                errors.add("Donor email is required");
            } else if (email == null) {
                errors.add("Invalid email format");
            }
        }

        String campaignName = orDefault(sanitizeText(input.getCampaignName(), 200), "General Donation");
        String frequency = orDefault(sanitizeText(input.getFrequency(), 20), "monthly");

        SanitizedDonation sanitized = SanitizedDonation.builder()
                .amount(amount.getValue())
                .donorName(orDefault(sanitizeText(input.getDonorName(), 100), "Anonymous"))
                .donorEmail(email)
                .donorPhone(orDefault(sanitizeText(input.getDonorPhone(), 20), null))
                .campaignId(orDefault(sanitizeText(input.getCampaignId(), 50), null))
                .campaignName(campaignName)
                .donationType(mapToDonationType(input.getCampaignName(), input.getDonationType()))
                .message(orDefault(sanitizeText(input.getMessage(), 500), null))
                .currency(orDefault(sanitizeText(input.getCurrency(), 3), "USD").toUpperCase(Locale.ROOT))
                .frequency(frequency.toLowerCase(Locale.ROOT))
                .occasion(orDefault(sanitizeText(input.getOccasion(), 100), null))
                .metadata(sanitizeMetadata(input.getMetadata(), input.getFrequency()))
                .build();

        return new SanitizationOutcome(List.copyOf(errors), sanitized);
    }

    /**
     * Keeps only the whitelisted metadata fields, sanitized, plus the frequency when given.
     */
    public Map<String, Object> sanitizeMetadata(Map<String, Object> raw, String frequency) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (raw != null) {
            for (String field : TEXT_METADATA_FIELDS) {
                Object value = raw.get(field);
                if (value != null && !String.valueOf(value).isBlank()) {
                    sanitized.put(field, sanitizeText(String.valueOf(value), 100));
                }
            }
            Object mealCount = raw.get("meal_count");
            if (mealCount != null) {
                sanitized.put("meal_count", parseInteger(mealCount));
            }
        }
        if (!isBlank(frequency)) {
            sanitized.put("frequency", sanitizeText(frequency, 20));
        }
        return sanitized;
    }

    private static Integer parseInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
