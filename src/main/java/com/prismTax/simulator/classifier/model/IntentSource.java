package com.prismTax.simulator.classifier.model;

/**
 * Which layer produced an intent.
 */
public enum IntentSource {
    CLASSIFIER("classifier"),
    FALLBACK("fallback");

    private final String label;

    IntentSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
