package com.example.reconcile.field;

import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.IdentityCode;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IBANs (ISO 13616): structure, per-country length for common countries and mod-97 checksum.
 */
@Component
public class IbanFieldHandler implements FieldHandler {

    static final String RULE = "iban.mod97";

    private static final Pattern STRUCTURE = Pattern.compile("[A-Z]{2}\\d{2}[A-Z0-9]{11,30}");
    private static final Pattern SPACES = Pattern.compile("[\\s\\-]+");

    private static final Map<String, Integer> COUNTRY_LENGTHS = Map.ofEntries(
            Map.entry("IT", 27), Map.entry("SM", 27), Map.entry("VA", 22), Map.entry("DE", 22),
            Map.entry("FR", 27), Map.entry("ES", 24), Map.entry("GB", 22), Map.entry("NL", 18),
            Map.entry("BE", 16), Map.entry("AT", 20), Map.entry("CH", 21), Map.entry("PT", 25),
            Map.entry("IE", 22), Map.entry("LU", 20), Map.entry("MC", 27), Map.entry("SI", 19),
            Map.entry("HR", 21), Map.entry("GR", 27), Map.entry("MT", 31), Map.entry("PL", 28));

    @Override
    public FieldType type() {
        return FieldType.IBAN;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String iban = SPACES.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (!STRUCTURE.matcher(iban).matches()) {
            return NormalizationOutcome.failed("invalid IBAN structure", RULE);
        }
        Integer expected = COUNTRY_LENGTHS.get(iban.substring(0, 2));
        if (expected != null && expected != iban.length()) {
            return NormalizationOutcome.failed("IBAN length %d does not match %d expected for %s"
                    .formatted(iban.length(), expected, iban.substring(0, 2)), RULE);
        }
        if (mod97(iban) != 1) {
            return NormalizationOutcome.failed("checksum invalid", RULE);
        }
        return NormalizationOutcome.strict(new IdentityCode(FieldType.IBAN, iban), RULE);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return STRICT_SCORE;
    }

    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        String canonical = field.value().canonical();
        if (canonical.equals(field.rawValue())) return Optional.empty();
        return Optional.of(new FixProposal(canonical, 0.90));
    }

    private static int mod97(String iban) {
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        int remainder = 0;
        for (char c : rearranged.toCharArray()) {
            int value = Character.isDigit(c) ? c - '0' : c - 'A' + 10;
            remainder = value > 9 ? (remainder * 100 + value) % 97 : (remainder * 10 + value) % 97;
        }
        return remainder;
    }
}
