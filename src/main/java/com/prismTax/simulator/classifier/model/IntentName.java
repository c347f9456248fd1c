package com.prismTax.simulator.classifier.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Intents the classifier may return, with their wire names.
 */
public enum IntentName {
    GET_TRANSACTION_SUMMARY("get_transaction_summary"),
    GET_TAX_RELIEF_INFO("get_tax_relief_info"),
    UPLOAD_RECEIPT("upload_receipt"),
    CATEGORIZE_EXPENSE("categorize_expense"),
    GET_TAX_CALCULATION("get_tax_calculation"),
    SET_REMINDER("set_reminder"),
    CONNECT_BANK("connect_bank"),
    ARTIFICIAL_TRANSACTION_WARNING("artificial_transaction_warning"),
    VERIFY_IDENTITY("verify_identity"),
    ONBOARDING("onboarding"),
    GENERAL_QUERY("general_query");

    private static final Set<IntentName> CALCULATION_INTENTS = EnumSet.of(GET_TAX_CALCULATION, CATEGORIZE_EXPENSE);

    private final String wireName;

    IntentName(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Intents that can be answered directly when the classifier already extracted an amount.
     */
    public boolean isCalculation() {
        return CALCULATION_INTENTS.contains(this);
    }

    /**
     * @return the matching intent, or null for an unknown or missing name
     */
    public static IntentName fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        for (IntentName name : values()) {
            if (name.wireName.equalsIgnoreCase(wireName.trim())) {
                return name;
            }
        }
        return null;
    }
}
