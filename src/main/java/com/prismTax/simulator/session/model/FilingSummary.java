package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Latest VAT reconciliation shown to the user, kept so "paid" can refer back to it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FilingSummary {
    private String period;
    private BigDecimal outputVat;
    private BigDecimal inputVat;
    private BigDecimal netVat;
    private String status;
    private boolean paid;
}
