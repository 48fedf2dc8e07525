package com.example.reconcile.field;

import com.example.reconcile.model.EmailAddress;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Email addresses under a conservative pattern: the domain needs at least one dot.
 * An address whose domain has no top-level domain is kept as a plausible value that
 * fails strict validation; anything else that does not match is a failure.
 */
@Component
public class EmailFieldHandler implements FieldHandler {

    static final String RULE_STRICT = "email.strict";
    static final String RULE_NO_TLD = "email.missing-tld";

    private static final Pattern LOCAL = Pattern.compile("[A-Za-z0-9_%+\\-]+(\\.[A-Za-z0-9_%+\\-]+)*");
    private static final Pattern DOMAIN = Pattern.compile("([A-Za-z0-9]([A-Za-z0-9\\-]*[A-Za-z0-9])?\\.)+[A-Za-z]{2,}");
    private static final Pattern DOMAIN_LABEL = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9\\-]*[A-Za-z0-9])?");
    private static final Pattern ADDRESS = Pattern.compile("([^@\\s]+)@([^@\\s]+)");

    @Override
    public FieldType type() {
        return FieldType.EMAIL;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        Matcher m = ADDRESS.matcher(raw.strip());
        if (!m.matches()) {
            return NormalizationOutcome.failed("not an email address", RULE_STRICT);
        }
        String local = m.group(1);
        String domain = m.group(2).toLowerCase(Locale.ROOT);
        if (!LOCAL.matcher(local).matches()) {
            return NormalizationOutcome.failed("invalid local part", RULE_STRICT);
        }
        EmailAddress address = new EmailAddress(local, domain);
        if (DOMAIN.matcher(domain).matches()) {
            return NormalizationOutcome.strict(address, RULE_STRICT);
        }
        if (DOMAIN_LABEL.matcher(domain).matches()) {
            return NormalizationOutcome.plausible(address, "email domain has no top-level domain", RULE_NO_TLD);
        }
        return NormalizationOutcome.failed("invalid domain", RULE_STRICT);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return field.isStrict() ? STRICT_SCORE : 0.92;
    }

    /** Trims and lower-cases the domain; the local part is left as written. */
    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        if (!field.isStrict()) return Optional.empty();
        String canonical = field.value().canonical();
        if (canonical.equals(field.rawValue())) return Optional.empty();
        return Optional.of(new FixProposal(canonical, 0.90));
    }
}
