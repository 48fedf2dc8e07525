package com.example.reconcile.field;

import com.example.reconcile.ReviewFixtures;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FiscalCodeFieldHandlerTest {

    private final FiscalCodeFieldHandler handler = new FiscalCodeFieldHandler();

    private static NormalizedField code(String raw) {
        return ReviewFixtures.field(FieldType.FISCAL_CODE, raw);
    }

    @Nested
    @DisplayName("personal codes")
    class PersonalCodes {

        @Test
        void validCode() {
            NormalizedField field = code("RSSMRA85T10A562S");

            assertThat(field.isStrict()).isTrue();
            assertThat(handler.baseScore(field)).isEqualTo(0.98);
            assertThat(handler.proposeFix(field)).isEmpty();
        }

        @Test
        @DisplayName("spacing and case are fixable")
        void spacingAndCase() {
            NormalizedField field = code("rssmra 85t10 a562s");

            assertThat(field.value().canonical()).isEqualTo("RSSMRA85T10A562S");
            assertThat(handler.proposeFix(field)).contains(new FixProposal("RSSMRA85T10A562S", 0.90));
        }

        @Test
        void wrongCheckCharacter() {
            assertThat(code("RSSMRA85T10A562X").failure().reason()).isEqualTo("checksum invalid");
            assertThat(FiscalCodeFieldHandler.checkCharacter("RSSMRA85T10A562")).isEqualTo('S');
        }

        @Test
        @DisplayName("decodes the birth date, including the +40 day offset for women")
        void birthDate() {
            assertThat(FiscalCodeFieldHandler.birthDateMatches("RSSMRA85T10A562S", LocalDate.of(1985, 12, 10))).isTrue();
            assertThat(FiscalCodeFieldHandler.birthDateMatches("RSSMRA85T10A562S", LocalDate.of(1985, 12, 11))).isFalse();
            assertThat(FiscalCodeFieldHandler.birthDateMatches("BNCLRA90A41H501F", LocalDate.of(1990, 1, 1))).isTrue();
        }
    }

    @Nested
    @DisplayName("numeric codes")
    class NumericCodes {

        @Test
        void validCode() {
            assertThat(code("12345678903").isStrict()).isTrue();
            assertThat(code("01234567897").isStrict()).isTrue();
        }

        @Test
        void wrongCheckDigit() {
            assertThat(code("01234567890").failure().reason()).isEqualTo("checksum invalid");
        }

        @Test
        @DisplayName("carry no birth date")
        void noBirthDate() {
            assertThat(FiscalCodeFieldHandler.birthDateMatches("12345678903", LocalDate.of(2000, 1, 1))).isTrue();
        }
    }

    @Test
    void wrongLength() {
        assertThat(code("RSSMRA85").failure().reason()).isEqualTo("fiscal code must have 16 or 11 characters");
    }
}
