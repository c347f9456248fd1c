package com.prismTax.simulator.grammar;

import java.util.regex.Pattern;

import static com.prismTax.simulator.grammar.AmountParser.AMOUNT_REGEX;

/**
 * Explicit commands understood in the registered zone.
 *
 * Declaration order is match order: first match wins, so narrower patterns come
 * before the broader ones they overlap with (e.g. mixed pension + business before
 * plain pension). Patterns are matched against the whole message, case-insensitively.
 */
public enum GrammarCommand {
    HELP("help|menu"),
    PROFILE("(?:my )?profile"),
    SUMMARY("(?:vat )?summary"),
    PAID("paid"),
    UPLOAD("upload(?: (?<document>invoice|receipt|bank statement|statement))?"),
    LIST_RELIEFS("(?:list )?reliefs"),
    ADD_RELIEF("(?:add )?relief (?<reliefType>[a-z][a-z_ ]*?) (?<amount>" + AMOUNT_REGEX + ")"),
    NEW_PROJECT("new project (?<name>.+?) (?<amount>" + AMOUNT_REGEX + ") from (?<source>.+)"),
    PROJECT_EXPENSE("project expense (?<amount>" + AMOUNT_REGEX + ")(?: (?<description>.+))?"),
    PROJECT_BALANCE("project balance"),
    COMPLETE_PROJECT("complete project"),
    MINIMUM_WAGE_CHECK("min(?:imum)? wage(?: check)?(?: (?<amount>" + AMOUNT_REGEX + "))?"),
    MIXED_PENSION_BUSINESS("pension (?<amount>" + AMOUNT_REGEX + ") (?:and |\\+ ?)?business (?<secondAmount>" + AMOUNT_REGEX + ")"),
    PENSION("pension (?:income )?(?<amount>" + AMOUNT_REGEX + ")"),
    FREELANCE("(?:freelance|business income|business) (?<amount>" + AMOUNT_REGEX + ")(?: expenses? (?<secondAmount>" + AMOUNT_REGEX + "))?"),
    RENTAL_INCOME("rent(?:al)?(?: income)? (?<amount>" + AMOUNT_REGEX + ")"),
    SIDE_HUSTLE("side hustle (?<amount>" + AMOUNT_REGEX + ")"),
    MONTHLY_TAX("(?:salary|paye|monthly tax) (?<amount>" + AMOUNT_REGEX + ")"),
    ANNUAL_TAX("(?:tax|income tax|annual tax) (?<amount>" + AMOUNT_REGEX + ")"),
    VAT("vat (?<amount>" + AMOUNT_REGEX + ")(?: (?<description>.+))?");

    private final Pattern pattern;

    GrammarCommand(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public Pattern getPattern() {
        return pattern;
    }
}
