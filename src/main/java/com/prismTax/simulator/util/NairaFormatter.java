package com.prismTax.simulator.util;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Formats amounts for bot replies, e.g. 1234567.5 becomes "₦1,234,567.5".
 */
public class NairaFormatter {

    private static final String SYMBOL = "₦";

    private NairaFormatter() {
    }

    public static String format(long amount) {
        return format(BigDecimal.valueOf(amount));
    }

    public static String format(BigDecimal amount) {
        if (amount == null) {
            return SYMBOL + "0";
        }
        // DecimalFormat is not thread-safe, build one per call
        DecimalFormat decimalFormat = new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.US));
        String formatted = decimalFormat.format(amount.abs());
        return (amount.signum() < 0 ? "-" : "") + SYMBOL + formatted;
    }

    /**
     * Formats a rate such as 0.075 as "7.5%".
     */
    public static String percent(BigDecimal rate) {
        if (rate == null) {
            return "0%";
        }
        DecimalFormat decimalFormat = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.US));
        return decimalFormat.format(rate.movePointRight(2)) + "%";
    }
}
