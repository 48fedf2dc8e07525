package com.example.reconcile.field;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.PhoneNumber;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Phone numbers: separators stripped, {@code 00} prefix read as {@code +}, result checked
 * against the E.164 shape and split on a known country calling code.
 */
@Component
public class PhoneFieldHandler implements FieldHandler {

    static final String RULE_E164 = "phone.e164";
    static final String RULE_DEFAULT_COUNTRY = "phone.e164.default-country";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s().\\-/]");
    private static final Pattern E164 = Pattern.compile("\\+[1-9]\\d{7,14}");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Set<String> COUNTRY_CODES = Set.of(
            "1", "7", "20", "27", "30", "31", "32", "33", "34", "36", "39", "40", "41", "43", "44", "45",
            "46", "47", "48", "49", "51", "52", "54", "55", "56", "57", "58", "60", "61", "62", "63", "64",
            "65", "66", "81", "82", "84", "86", "90", "91", "92", "93", "94", "95", "98", "212", "213",
            "216", "351", "352", "353", "354", "355", "356", "357", "358", "359", "370", "371", "372",
            "373", "374", "375", "376", "377", "378", "380", "381", "382", "385", "386", "387", "389",
            "420", "421", "423");

    private final String defaultCountryCode;

    public PhoneFieldHandler(ReviewProperties properties) {
        this.defaultCountryCode = properties.normalization().defaultCountryCode();
    }

    @Override
    public FieldType type() {
        return FieldType.PHONE;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String compact = SEPARATORS.matcher(raw.strip()).replaceAll("");
        String rule = RULE_E164;
        if (compact.startsWith("00")) {
            compact = "+" + compact.substring(2);
        } else if (!compact.startsWith("+")) {
            if (!DIGITS.matcher(compact).matches()) {
                return NormalizationOutcome.failed("phone number contains non-digit characters", RULE_E164);
            }
            compact = "+" + defaultCountryCode + compact;
            rule = RULE_DEFAULT_COUNTRY;
        }
        if (!E164.matcher(compact).matches()) {
            return NormalizationOutcome.failed("not an E.164 phone number", RULE_E164);
        }

        String digits = compact.substring(1);
        String countryCode = countryCodeOf(digits);
        if (countryCode == null) {
            return NormalizationOutcome.failed("unknown country calling code", RULE_E164);
        }
        String subscriber = digits.substring(countryCode.length());
        if (subscriber.length() < 6) {
            return NormalizationOutcome.failed("subscriber number too short", RULE_E164);
        }
        return NormalizationOutcome.strict(new PhoneNumber(countryCode, subscriber), rule);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return RULE_DEFAULT_COUNTRY.equals(field.ruleId()) ? 0.96 : STRICT_SCORE;
    }

    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        String canonical = field.value().canonical();
        if (canonical.equals(field.rawValue())) return Optional.empty();
        // an assumed country code is the only part not read from the document
        double confidence = RULE_DEFAULT_COUNTRY.equals(field.ruleId()) ? 0.80 : 0.95;
        return Optional.of(new FixProposal(canonical, confidence));
    }

    private String countryCodeOf(String digits) {
        if (digits.startsWith(defaultCountryCode)) return defaultCountryCode;
        for (int length = 3; length >= 1; length--) {
            if (digits.length() > length && COUNTRY_CODES.contains(digits.substring(0, length))) {
                return digits.substring(0, length);
            }
        }
        return null;
    }
}
