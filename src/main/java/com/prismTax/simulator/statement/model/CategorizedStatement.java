package com.prismTax.simulator.statement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of categorizing one uploaded bank statement.
 *
 * Credit and debit totals are kept per category so that every input line is
 * accounted for exactly once. The review queue is a subset of the SALES lines.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CategorizedStatement {

    private List<CategorizedTransaction> transactions;

    private Map<TransactionCategory, BigDecimal> creditTotals;

    private Map<TransactionCategory, BigDecimal> debitTotals;

    private BigDecimal totalCredits;

    private BigDecimal totalDebits;

    private BigDecimal outputVat;

    private BigDecimal inputVat;

    /**
     * outputVat - inputVat; negative when the business is in a credit position.
     */
    private BigDecimal netVat;

    private List<CategorizedTransaction> reviewQueue;

    public BigDecimal creditTotal(TransactionCategory category) {
        return creditTotals.getOrDefault(category, BigDecimal.ZERO);
    }

    public BigDecimal debitTotal(TransactionCategory category) {
        return debitTotals.getOrDefault(category, BigDecimal.ZERO);
    }
}
