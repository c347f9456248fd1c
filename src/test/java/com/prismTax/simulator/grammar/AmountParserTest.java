package com.prismTax.simulator.grammar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AmountParser")
class AmountParserTest {

    @ParameterizedTest
    @ValueSource(strings = {"50,000", "50000", "₦50000", "N50000", "n50,000", "NGN 50000", "ngn50000", " 50000 "})
    @DisplayName("separators, currency symbol and prefix are stripped")
    void parsesEquivalentForms(String text) {
        assertThat(AmountParser.parse(text)).isEqualTo(50_000L);
    }

    @Test
    @DisplayName("fractional part is dropped")
    void dropsFraction() {
        assertThat(AmountParser.parse("1,234.99")).isEqualTo(1_234L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "$500", "-500", "50k", ",500"})
    void rejectsNonAmounts(String text) {
        assertThat(AmountParser.parse(text)).isNull();
    }

    @Test
    void rejectsNullAndOverflow() {
        assertThat(AmountParser.parse(null)).isNull();
        assertThat(AmountParser.parse("9999999999999999999")).isNull();
    }
}
