package com.example.reconcile.field;

import com.example.reconcile.ReviewFixtures;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.MonetaryAmount;
import com.example.reconcile.model.NormalizedField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AmountFieldHandlerTest {

    private final AmountFieldHandler handler = new AmountFieldHandler(ReviewFixtures.PROPERTIES);

    private static NormalizedField amount(String raw) {
        return ReviewFixtures.field(FieldType.AMOUNT, raw);
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "€ 1.200,00; 1200.00 EUR",
            "Euro 1.200,00; 1200.00 EUR",
            "1,200.50 USD; 1200.50 USD",
            "£15; 15.00 GBP",
            "1200; 1200.00 EUR",
            "12,5; 12.50 EUR",
            "1.234.567; 1234567.00 EUR",
            "-150,00 €; -150.00 EUR",
            "150,00-; -150.00 EUR"
    })
    @DisplayName("parses separators, currency markers and sign")
    void parses(String raw, String canonical) {
        assertThat(amount(raw).value().canonical()).isEqualTo(canonical);
    }

    @Test
    @DisplayName("an unmarked amount takes the default currency")
    void defaultCurrency() {
        NormalizedField field = amount("1200.00");

        assertThat(field.ruleId()).isEqualTo(AmountFieldHandler.RULE_DEFAULT_CURRENCY);
        assertThat(handler.baseScore(field)).isEqualTo(0.98);
    }

    @Test
    @DisplayName("a single three-digit group is read as thousands with a lower score")
    void ambiguousSeparator() {
        NormalizedField field = amount("1.200");

        assertThat(field.value().canonical()).isEqualTo("1200.00 EUR");
        assertThat(handler.baseScore(field)).isEqualTo(0.90);
    }

    @Test
    @DisplayName("refund and payment share a grouping key")
    void groupingKeyIgnoresSign() {
        MonetaryAmount refund = (MonetaryAmount) amount("-150,00").value();

        assertThat(refund.signum()).isNegative();
        assertThat(refund.groupingKey()).isEqualTo(amount("150,00").value().groupingKey());
    }

    @Test
    void failures() {
        assertThat(amount("$ 10 EUR").failure().reason()).isEqualTo("conflicting currency markers");
        assertThat(amount("dieci").failure().reason()).isEqualTo("no recognized amount pattern");
        assertThat(amount("12.34.5").failure().reason()).isEqualTo("malformed digit grouping");
        assertThat(amount("-10-").failure().reason()).isEqualTo("amount carries two signs");
    }

    @Test
    @DisplayName("never rewrites an amount")
    void noFix() {
        assertThat(handler.proposeFix(amount("1.200"))).isEmpty();
    }
}
