package com.prismTax.simulator.grammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Naira amounts typed by users: "50,000", "50000", "₦50000", "N50000", "NGN 50000" all yield 50000.
 * Thousands separators, the currency symbol or prefix and any fractional part are dropped.
 */
public class AmountParser {

    /**
     * Amount token as it appears inside a command.
     */
    public static final String AMOUNT_REGEX = "(?:₦|ngn\\s?|n)?\\d[\\d,]*(?:\\.\\d+)?";

    private static final Pattern AMOUNT_PATTERN = Pattern.compile(
            "^(?:₦|ngn\\s?|n)?(\\d[\\d,]*)(?:\\.\\d+)?$", Pattern.CASE_INSENSITIVE);

    private AmountParser() {
    }

    /**
     * @param text a single amount token
     * @return the integer amount, or null when the text is not an amount or does not fit in a long
     */
    public static Long parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = AMOUNT_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        String digits = matcher.group(1).replace(",", "");
        if (digits.length() > 18) {
            return null;
        }
        return Long.parseLong(digits);
    }
}
