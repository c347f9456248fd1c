package com.prismTax.simulator.session.model;

import java.util.Locale;

/**
 * Employment status collected during individual onboarding.
 * Each value doubles as a reply button.
 */
public enum EmploymentStatus {
    EMPLOYED("employment_employed", "Employed"),
    SELF_EMPLOYED("employment_self_employed", "Self-employed"),
    RETIRED("employment_retired", "Retired");

    private final String buttonId;
    private final String label;

    EmploymentStatus(String buttonId, String label) {
        this.buttonId = buttonId;
        this.label = label;
    }

    public String getButtonId() {
        return buttonId;
    }

    public String getLabel() {
        return label;
    }

    public static EmploymentStatus fromButtonId(String buttonId) {
        for (EmploymentStatus status : values()) {
            if (status.buttonId.equals(buttonId)) {
                return status;
            }
        }
        return null;
    }

    /**
     * Parses free text such as "self employed" or "Retired".
     *
     * @return matching status, or null when the text names none
     */
    public static EmploymentStatus fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
        return switch (normalized) {
            case "employed", "1" -> EMPLOYED;
            case "self employed", "selfemployed", "2" -> SELF_EMPLOYED;
            case "retired", "3" -> RETIRED;
            default -> null;
        };
    }
}
