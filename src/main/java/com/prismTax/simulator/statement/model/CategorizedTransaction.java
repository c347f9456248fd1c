package com.prismTax.simulator.statement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CategorizedTransaction {

    private StatementTransaction transaction;

    private TransactionCategory category;

    /**
     * Advisory text, null when nothing about the line needs attention.
     */
    private String riskFlag;
}
