package com.example.reconcile.field;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.FreeText;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Free text: whitespace collapsed, characters left by encoding errors removed.
 * Text that contained such characters is plausible but fails strict validation.
 * Configured keywords are recorded on the value for signal reporting.
 */
@Component
public class FreeTextFieldHandler implements FieldHandler {

    static final String RULE_CLEAN = "text.clean";
    static final String RULE_ENCODING_NOISE = "text.encoding-noise";

    private static final Pattern NOISE = Pattern.compile("[\\uFFFD\\p{Cc}&&[^\\t\\n\\r]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final List<String> flaggedKeywords;

    public FreeTextFieldHandler(ReviewProperties properties) {
        this.flaggedKeywords = properties.normalization().flaggedKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public FieldType type() {
        return FieldType.FREE_TEXT;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        boolean noisy = NOISE.matcher(raw).find();
        String cleaned = WHITESPACE.matcher(NOISE.matcher(raw).replaceAll(" ")).replaceAll(" ").strip();
        if (cleaned.isEmpty()) {
            return NormalizationOutcome.failed("no readable text", RULE_ENCODING_NOISE);
        }
        FreeText text = new FreeText(cleaned, keywordsIn(cleaned));
        return noisy
                ? NormalizationOutcome.plausible(text, "text contains unreadable characters", RULE_ENCODING_NOISE)
                : NormalizationOutcome.strict(text, RULE_CLEAN);
    }

    @Override
    public double baseScore(NormalizedField field) {
        return field.isStrict() ? STRICT_SCORE : 0.70;
    }

    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        // unreadable characters stand for lost content, not formatting
        if (!field.isStrict()) return Optional.empty();
        String canonical = field.value().canonical();
        if (canonical.equals(field.rawValue())) return Optional.empty();
        return Optional.of(new FixProposal(canonical, 0.99));
    }

    private List<String> keywordsIn(String text) {
        List<String> words = List.of(WORD_BOUNDARY.split(text.toLowerCase(Locale.ROOT)));
        return flaggedKeywords.stream().filter(words::contains).toList();
    }
}
