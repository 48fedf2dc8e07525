package com.example.reconcile.field;

import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.IdentityCode;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Italian fiscal codes: the 16-character personal code with its check character
 * (omocodia substitutions accepted) and the 11-digit numeric code of legal entities.
 * Invalid codes are reported, never corrected.
 */
@Component
public class FiscalCodeFieldHandler implements FieldHandler {

    static final String RULE_PERSON = "fiscal-code.person";
    static final String RULE_NUMERIC = "fiscal-code.numeric";

    private static final Pattern PERSON = Pattern.compile(
            "[A-Z]{6}[0-9LMNPQRSTUV]{2}[ABCDEHLMPRST][0-9LMNPQRSTUV]{2}[A-Z][0-9LMNPQRSTUV]{3}[A-Z]");
    private static final Pattern NUMERIC = Pattern.compile("\\d{11}");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private static final int[] ODD_VALUES = {
            1, 0, 5, 7, 9, 13, 15, 17, 19, 21, 2, 4, 18, 20, 11, 3, 6, 8, 12, 14, 16, 10, 22, 25, 24, 23
    };
    private static final String MONTH_LETTERS = "ABCDEHLMPRST";
    private static final String OMOCODIA = "LMNPQRSTUV";

    @Override
    public FieldType type() {
        return FieldType.FISCAL_CODE;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String code = SPACES.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (code.length() == 16) {
            if (!PERSON.matcher(code).matches()) {
                return NormalizationOutcome.failed("invalid character classes for a 16-character fiscal code", RULE_PERSON);
            }
            if (checkCharacter(code) != code.charAt(15)) {
                return NormalizationOutcome.failed("checksum invalid", RULE_PERSON);
            }
            return NormalizationOutcome.strict(new IdentityCode(FieldType.FISCAL_CODE, code), RULE_PERSON);
        }
        if (code.length() == 11) {
            if (!NUMERIC.matcher(code).matches()) {
                return NormalizationOutcome.failed("11-character fiscal code must be numeric", RULE_NUMERIC);
            }
            if (numericCheckDigit(code) != code.charAt(10) - '0') {
                return NormalizationOutcome.failed("checksum invalid", RULE_NUMERIC);
            }
            return NormalizationOutcome.strict(new IdentityCode(FieldType.FISCAL_CODE, code), RULE_NUMERIC);
        }
        return NormalizationOutcome.failed("fiscal code must have 16 or 11 characters", RULE_PERSON);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return STRICT_SCORE;
    }

    /** Only spacing and letter case; the code itself is never changed. */
    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        String canonical = field.value().canonical();
        if (canonical.equals(field.rawValue())) return Optional.empty();
        return Optional.of(new FixProposal(canonical, 0.90));
    }

    /**
     * Whether the birth date encoded in a 16-character code matches {@code birthDate}.
     * Codes of legal entities carry no birth date and always match.
     */
    public static boolean birthDateMatches(String code, LocalDate birthDate) {
        if (code.length() != 16) return true;
        int year = Integer.parseInt(decodeDigits(code.substring(6, 8)));
        int month = MONTH_LETTERS.indexOf(code.charAt(8)) + 1;
        int day = Integer.parseInt(decodeDigits(code.substring(9, 11)));
        if (day > 40) day -= 40;
        return year == birthDate.getYear() % 100
                && month == birthDate.getMonthValue()
                && day == birthDate.getDayOfMonth();
    }

    static char checkCharacter(String code) {
        int sum = 0;
        for (int i = 0; i < 15; i++) {
            char c = code.charAt(i);
            int index = Character.isDigit(c) ? c - '0' : c - 'A';
            sum += i % 2 == 0 ? ODD_VALUES[index] : index;
        }
        return (char) ('A' + sum % 26);
    }

    private static int numericCheckDigit(String code) {
        int sum = 0;
        for (int i = 0; i < 10; i++) {
            int digit = code.charAt(i) - '0';
            if (i % 2 == 1) {
                digit *= 2;
                if (digit > 9) digit -= 9;
            }
            sum += digit;
        }
        return (10 - sum % 10) % 10;
    }

    private static String decodeDigits(String part) {
        StringBuilder digits = new StringBuilder(part.length());
        for (char c : part.toCharArray()) {
            int omocodia = OMOCODIA.indexOf(c);
            digits.append(omocodia >= 0 ? (char) ('0' + omocodia) : c);
        }
        return digits.toString();
    }
}
