package com.prismTax.simulator.risk.model;

/**
 * Advisory raised by the risk heuristic. Advisories annotate replies and never block an operation.
 */
public enum RiskFlag {
    LARGE_CASH_EXPENSE("Large cash-based expense",
            "⚠️ Large cash-based expense. Keep receipts and a signed payment voucher; "
                    + "cash payments of this size are often reviewed for artificial transactions (Section 191)."),
    VAGUE_DESCRIPTION("Vague description",
            "⚠️ Vague description. Record exactly what was bought or paid for so the expense "
                    + "can be supported during a review.");

    private final String label;
    private final String advisory;

    RiskFlag(String label, String advisory) {
        this.label = label;
        this.advisory = advisory;
    }

    /**
     * Short form used on statement lines.
     */
    public String getLabel() {
        return label;
    }

    public String getAdvisory() {
        return advisory;
    }
}
