package com.example.reconcile.field;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.MonetaryAmount;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Currency amounts: symbol prefixed or suffixed, comma or dot decimals, thousands groups,
 * explicit sign. Produces a signed decimal (scale at least 2) with an ISO currency code.
 * Magnitude and sign are kept as read; sign disagreements are left to corroboration and
 * consistency checks.
 */
@Component
public class AmountFieldHandler implements FieldHandler {

    static final String RULE_PLAIN = "amount.plain";
    static final String RULE_GROUPED = "amount.grouped";
    static final String RULE_AMBIGUOUS = "amount.ambiguous-separator";
    static final String RULE_DEFAULT_CURRENCY = "amount.default-currency";

    private static final Map<String, String> CURRENCY_MARKERS = new LinkedHashMap<>();

    static {
        CURRENCY_MARKERS.put("euro", "EUR");
        CURRENCY_MARKERS.put("eur", "EUR");
        CURRENCY_MARKERS.put("€", "EUR");
        CURRENCY_MARKERS.put("dollars", "USD");
        CURRENCY_MARKERS.put("dollar", "USD");
        CURRENCY_MARKERS.put("usd", "USD");
        CURRENCY_MARKERS.put("$", "USD");
        CURRENCY_MARKERS.put("gbp", "GBP");
        CURRENCY_MARKERS.put("£", "GBP");
    }

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern NUMBER = Pattern.compile("([+-]?)([\\d.,']+)(-?)");
    private static final Pattern GROUPED_DOT = Pattern.compile("\\d{1,3}(\\.\\d{3})+");
    private static final Pattern GROUPED_COMMA = Pattern.compile("\\d{1,3}(,\\d{3})+");
    private static final Pattern GROUPED_APOSTROPHE = Pattern.compile("\\d{1,3}('\\d{3})+");

    private final String defaultCurrency;

    public AmountFieldHandler(ReviewProperties properties) {
        this.defaultCurrency = properties.normalization().defaultCurrency();
    }

    @Override
    public FieldType type() {
        return FieldType.AMOUNT;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String text = raw.strip().toLowerCase(Locale.ROOT);

        String currency = null;
        for (Map.Entry<String, String> marker : CURRENCY_MARKERS.entrySet()) {
            if (text.contains(marker.getKey())) {
                if (currency != null && !currency.equals(marker.getValue())) {
                    return NormalizationOutcome.failed("conflicting currency markers", "amount.currency");
                }
                currency = marker.getValue();
                text = text.replace(marker.getKey(), " ");
            }
        }
        text = WHITESPACE.matcher(text).replaceAll("");

        Matcher m = NUMBER.matcher(text);
        if (!m.matches()) {
            return NormalizationOutcome.failed("no recognized amount pattern", "amount.pattern");
        }
        boolean negative = "-".equals(m.group(1)) || "-".equals(m.group(3));
        if ("-".equals(m.group(1)) && "-".equals(m.group(3))) {
            return NormalizationOutcome.failed("amount carries two signs", "amount.sign");
        }

        String digits = m.group(2);
        String rule;
        String plain;
        int lastDot = digits.lastIndexOf('.');
        int lastComma = digits.lastIndexOf(',');
        if (digits.indexOf('\'') >= 0) {
            if (!GROUPED_APOSTROPHE.matcher(digits).matches()) return malformed();
            plain = digits.replace("'", "");
            rule = RULE_GROUPED;
        } else if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            String integerPart = digits.substring(0, Math.max(lastDot, lastComma));
            String fraction = digits.substring(Math.max(lastDot, lastComma) + 1);
            Pattern grouped = grouping == '.' ? GROUPED_DOT : GROUPED_COMMA;
            if (!grouped.matcher(integerPart).matches() || fraction.isEmpty() || !fraction.chars().allMatch(Character::isDigit)) {
                return malformed();
            }
            plain = integerPart.replace(String.valueOf(grouping), "") + "." + fraction;
            rule = RULE_GROUPED;
        } else if (lastDot >= 0 || lastComma >= 0) {
            char separator = lastDot >= 0 ? '.' : ',';
            String sep = String.valueOf(separator);
            int occurrences = digits.length() - digits.replace(sep, "").length();
            String fraction = digits.substring(digits.lastIndexOf(separator) + 1);
            if (occurrences > 1) {
                Pattern grouped = separator == '.' ? GROUPED_DOT : GROUPED_COMMA;
                if (!grouped.matcher(digits).matches()) return malformed();
                plain = digits.replace(sep, "");
                rule = RULE_GROUPED;
            } else if (fraction.length() == 3 && GROUPED_DOT.matcher(digits.replace(',', '.')).matches()) {
                // "1.200" / "1,200": read as a thousands group, as Italian documents write it
                plain = digits.replace(sep, "");
                rule = RULE_AMBIGUOUS;
            } else {
                if (fraction.isEmpty() || digits.startsWith(sep)) return malformed();
                plain = digits.replace(separator, '.');
                rule = RULE_PLAIN;
            }
        } else {
            plain = digits;
            rule = RULE_PLAIN;
        }

        BigDecimal value = new BigDecimal(plain);
        if (value.scale() < 2) value = value.setScale(2, RoundingMode.UNNECESSARY);
        if (negative) value = value.negate();
        if (currency == null) {
            currency = defaultCurrency;
            if (RULE_PLAIN.equals(rule)) rule = RULE_DEFAULT_CURRENCY;
        }
        return NormalizationOutcome.strict(new MonetaryAmount(value, currency), rule);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return RULE_AMBIGUOUS.equals(field.ruleId()) ? 0.90 : STRICT_SCORE;
    }

    /** Amount surface forms are never rewritten: "1.200" could also be read as 1.2. */
    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        return Optional.empty();
    }

    private static NormalizationOutcome malformed() {
        return NormalizationOutcome.failed("malformed digit grouping", "amount.grouping");
    }
}
