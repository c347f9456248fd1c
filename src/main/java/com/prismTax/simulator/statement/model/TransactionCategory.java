package com.prismTax.simulator.statement.model;

public enum TransactionCategory {
    SALES("Sales"),
    TRANSFERS_IN("Transfers In"),
    EXPENSES("Expenses"),
    UTILITIES("Utilities"),
    SALARIES("Salaries"),
    OTHER("Other");

    private final String label;

    TransactionCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
