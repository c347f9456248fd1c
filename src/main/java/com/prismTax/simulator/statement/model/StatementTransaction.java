package com.prismTax.simulator.statement.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw bank statement line as extracted by OCR. At most one of credit / debit is positive;
 * OCR may fill the unused column with zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatementTransaction {

    @JsonProperty("date")
    private String date;

    @JsonProperty("description")
    private String description;

    @JsonProperty("credit")
    private BigDecimal credit;

    @JsonProperty("debit")
    private BigDecimal debit;

    public boolean hasCredit() {
        return credit != null && credit.signum() > 0;
    }

    public boolean hasDebit() {
        return debit != null && debit.signum() > 0;
    }
}
