package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Invoice extracted by OCR and waiting for the user to confirm or discard it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingInvoice {

    private String vendor;
    private String invoiceNumber;
    private String invoiceDate;
    private List<LineItem> lineItems;
    private BigDecimal subtotal;
    private BigDecimal vatAmount;
    private BigDecimal total;

    /**
     * "Input VAT" for purchases, "Output VAT" for sales.
     */
    private String classification;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class LineItem {
        private String description;
        private BigDecimal amount;
    }
}
