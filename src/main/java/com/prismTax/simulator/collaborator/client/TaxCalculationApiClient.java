package com.prismTax.simulator.collaborator.client;

import com.prismTax.simulator.collaborator.dto.IncomeTaxRequest;
import com.prismTax.simulator.collaborator.dto.IncomeTaxResponse;
import com.prismTax.simulator.collaborator.dto.VatCalculationRequest;
import com.prismTax.simulator.collaborator.dto.VatCalculationResponse;
import com.prismTax.simulator.collaborator.dto.VatReconciliationRequest;
import com.prismTax.simulator.collaborator.dto.VatReconciliationResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Client for the tax calculation service.
 *
 * Endpoints:
 * - VAT calculation on a single item
 * - Personal / business income tax
 * - Monthly VAT reconciliation for filing summaries
 */
@Service
public class TaxCalculationApiClient extends CollaboratorRestClient {

    public static final String VAT_CALCULATION = "VAT calculation";
    public static final String INCOME_TAX_CALCULATION = "Tax calculation";
    public static final String VAT_RECONCILIATION = "VAT summary";

    public TaxCalculationApiClient(
            @Value("${collaborator.tax.base-url:http://localhost:8090/api}") String baseUrl,
            @Value("${collaborator.tax.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${collaborator.tax.read-timeout-ms:15000}") int readTimeoutMs) {
        super("Tax calculation API", baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    public VatCalculationResponse calculateVat(VatCalculationRequest request, String correlationId) {
        return post("/vat/calculate", request, VatCalculationResponse.class, VAT_CALCULATION, correlationId);
    }

    public IncomeTaxResponse calculateIncomeTax(IncomeTaxRequest request, String correlationId) {
        return post("/income-tax/calculate", request, IncomeTaxResponse.class, INCOME_TAX_CALCULATION, correlationId);
    }

    public VatReconciliationResponse reconcileVat(VatReconciliationRequest request, String correlationId) {
        return post("/vat/reconcile", request, VatReconciliationResponse.class, VAT_RECONCILIATION, correlationId);
    }
}
