package com.prismTax.simulator.grammar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CommandGrammarMatcher")
class CommandGrammarMatcherTest {

    private final CommandGrammarMatcher matcher = new CommandGrammarMatcher();

    private CommandMatch matched(String text) {
        Optional<CommandMatch> match = matcher.match(text);
        assertThat(match).as("match for '%s'", text).isPresent();
        return match.get();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("mixed pension and business wins over plain pension")
        void mixedBeforePension() {
            CommandMatch match = matched("pension 2,400,000 business 1,200,000");

            assertThat(match.getCommand()).isEqualTo(GrammarCommand.MIXED_PENSION_BUSINESS);
            assertThat(match.getAmount()).isEqualTo(2_400_000L);
            assertThat(match.getSecondAmount()).isEqualTo(1_200_000L);
        }

        @Test
        void plainPension() {
            CommandMatch match = matched("pension 2400000");

            assertThat(match.getCommand()).isEqualTo(GrammarCommand.PENSION);
            assertThat(match.getAmount()).isEqualTo(2_400_000L);
        }

        @Test
        @DisplayName("vat summary is the filing summary, not a VAT calculation")
        void vatSummaryBeforeVat() {
            assertThat(matched("vat summary").getCommand()).isEqualTo(GrammarCommand.SUMMARY);
        }

        @Test
        @DisplayName("project expense is not parsed as a new project")
        void projectExpense() {
            CommandMatch match = matched("project expense 4,700,000 cement and blocks");

            assertThat(match.getCommand()).isEqualTo(GrammarCommand.PROJECT_EXPENSE);
            assertThat(match.getAmount()).isEqualTo(4_700_000L);
            assertThat(match.getDescription()).isEqualTo("cement and blocks");
        }
    }

    @Test
    @DisplayName("vat with description")
    void vatWithDescription() {
        CommandMatch match = matched("vat 50000 electronics");

        assertThat(match.getCommand()).isEqualTo(GrammarCommand.VAT);
        assertThat(match.getAmount()).isEqualTo(50_000L);
        assertThat(match.getDescription()).isEqualTo("electronics");
    }

    @Test
    @DisplayName("new project keeps the casing of name and source")
    void newProject() {
        CommandMatch match = matched("New Project  Uncle Building 5,000,000 from Uncle Chukwu");

        assertThat(match.getCommand()).isEqualTo(GrammarCommand.NEW_PROJECT);
        assertThat(match.getName()).isEqualTo("Uncle Building");
        assertThat(match.getAmount()).isEqualTo(5_000_000L);
        assertThat(match.getSource()).isEqualTo("Uncle Chukwu");
    }

    @Test
    void freelanceWithOptionalExpenses() {
        CommandMatch withExpenses = matched("freelance 7200000 expenses 1800000");
        CommandMatch withoutExpenses = matched("freelance 7200000");

        assertThat(withExpenses.getCommand()).isEqualTo(GrammarCommand.FREELANCE);
        assertThat(withExpenses.getSecondAmount()).isEqualTo(1_800_000L);
        assertThat(withoutExpenses.getSecondAmount()).isNull();
    }

    @Test
    void incomeTaxForms() {
        assertThat(matched("tax ₦10,000,000").getCommand()).isEqualTo(GrammarCommand.ANNUAL_TAX);
        assertThat(matched("salary 450000").getCommand()).isEqualTo(GrammarCommand.MONTHLY_TAX);
        assertThat(matched("rental income 2400000").getCommand()).isEqualTo(GrammarCommand.RENTAL_INCOME);
        assertThat(matched("minimum wage check").getAmount()).isNull();
    }

    @Test
    void addRelief() {
        CommandMatch match = matched("add relief pension 240000");

        assertThat(match.getCommand()).isEqualTo(GrammarCommand.ADD_RELIEF);
        assertThat(match.getReliefType()).isEqualTo("pension");
        assertThat(match.getAmount()).isEqualTo(240_000L);
    }

    @Test
    @DisplayName("free text falls through")
    void freeTextIsNotACommand() {
        assertThat(matcher.match("how much tax do I pay on my salary?")).isEmpty();
        assertThat(matcher.match("vat")).isEmpty();
        assertThat(matcher.match("   ")).isEmpty();
        assertThat(matcher.match(null)).isEmpty();
    }
}
