package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prismTax.simulator.statement.model.StatementTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * OCR extraction result. {@code invoice} is filled for invoices, {@code transactions} for bank statements.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentOcrResponse {

    @JsonProperty("documentType")
    private DocumentType documentType;

    @JsonProperty("invoice")
    private InvoiceFields invoice;

    @JsonProperty("transactions")
    private List<StatementTransaction> transactions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InvoiceFields {

        @JsonProperty("vendor")
        private String vendor;

        @JsonProperty("invoiceNumber")
        private String invoiceNumber;

        @JsonProperty("date")
        private String date;

        @JsonProperty("lineItems")
        private List<LineItem> lineItems;

        @JsonProperty("subtotal")
        private BigDecimal subtotal;

        @JsonProperty("vatAmount")
        private BigDecimal vatAmount;

        @JsonProperty("total")
        private BigDecimal total;

        @JsonProperty("classification")
        private String classification;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LineItem {

        @JsonProperty("description")
        private String description;

        @JsonProperty("amount")
        private BigDecimal amount;
    }
}
