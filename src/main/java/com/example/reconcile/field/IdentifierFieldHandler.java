package com.example.reconcile.field;

import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.IdentityCode;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reference codes such as policy numbers and ticket ids: upper-case alphanumerics
 * with {@code - / .} separators. Inner whitespace is a failure, since joining the
 * pieces could produce a different identifier.
 */
@Component
public class IdentifierFieldHandler implements FieldHandler {

    static final String RULE = "identifier.code";

    private static final Pattern CODE = Pattern.compile("[A-Z0-9]([A-Z0-9\\-/.]*[A-Z0-9])?");

    @Override
    public FieldType type() {
        return FieldType.IDENTIFIER;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String code = raw.strip().toUpperCase(Locale.ROOT);
        if (code.chars().anyMatch(Character::isWhitespace)) {
            return NormalizationOutcome.failed("identifier contains whitespace", RULE);
        }
        if (code.length() < 3 || !CODE.matcher(code).matches()) {
            return NormalizationOutcome.failed("not a reference code", RULE);
        }
        return NormalizationOutcome.strict(new IdentityCode(FieldType.IDENTIFIER, code), RULE);
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
}
