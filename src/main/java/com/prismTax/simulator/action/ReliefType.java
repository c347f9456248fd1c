package com.prismTax.simulator.action;

import java.util.Locale;

/**
 * Reliefs the simulator can explain and record. Each value doubles as a list-menu row.
 */
public enum ReliefType {
    PENSION("relief_pension", "Pension", "👴",
            "Contributions to approved pension schemes are tax-deductible.",
            "Up to 8% of basic salary", "Section 69 NTA 2025"),
    NHF("relief_nhf", "National Housing Fund", "🏠",
            "2.5% contribution to NHF is tax-deductible.",
            "2.5% of basic salary", "NHF Act"),
    NHIS("relief_nhis", "Health Insurance", "🏥",
            "Contributions to NHIS or approved health insurance are deductible.",
            "Actual contribution", "Section 71 NTA 2025"),
    RENT("relief_rent", "Rent Relief", "🏡",
            "Rent paid for your residential accommodation.",
            "20% of annual rent, capped at ₦500,000", "Section 30 NTA 2025"),
    MORTGAGE("relief_mortgage", "Mortgage Interest", "🏘️",
            "Interest on a mortgage for your owner-occupied home.",
            "Actual interest paid", "Section 30 NTA 2025"),
    LIFE_INSURANCE("relief_life_insurance", "Life Insurance", "🛡️",
            "Premiums on a life insurance policy for you or your spouse.",
            "Actual premium paid", "Section 30 NTA 2025"),
    SMALL_BIZ("relief_small_biz", "Small Business Exemption", "🏪",
            "Companies with turnover of ₦100m or less and fixed assets under ₦250m pay 0% company income tax.",
            "Turnover ≤ ₦100m", "Section 56 NTA 2025"),
    STARTUP("relief_startup", "Startup Exemption", "🚀",
            "Labelled startups enjoy tax incentives during their first years of operation.",
            "Certified startups", "Nigeria Startup Act 2022");

    private final String buttonId;
    private final String title;
    private final String emoji;
    private final String description;
    private final String limit;
    private final String reference;

    ReliefType(String buttonId, String title, String emoji, String description, String limit, String reference) {
        this.buttonId = buttonId;
        this.title = title;
        this.emoji = emoji;
        this.description = description;
        this.limit = limit;
        this.reference = reference;
    }

    public String getButtonId() {
        return buttonId;
    }

    public String getTitle() {
        return title;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDescription() {
        return description;
    }

    public String getLimit() {
        return limit;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Short key stored on the profile, e.g. "life_insurance".
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReliefType fromButtonId(String buttonId) {
        for (ReliefType type : values()) {
            if (type.buttonId.equals(buttonId)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Parses a typed relief name such as "nhf", "life insurance" or "small business".
     *
     * @return the relief, or null when the text names none
     */
    public static ReliefType fromText(String text) {
        if (text == null) {
            return null;
        }
        String key = text.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return switch (key) {
            case "pension" -> PENSION;
            case "nhf", "housing_fund" -> NHF;
            case "nhis", "health", "health_insurance" -> NHIS;
            case "rent", "housing" -> RENT;
            case "mortgage" -> MORTGAGE;
            case "life_insurance", "insurance" -> LIFE_INSURANCE;
            case "small_biz", "small_business" -> SMALL_BIZ;
            case "startup" -> STARTUP;
            default -> null;
        };
    }
}
