package com.prismTax.simulator.collaborator.client;

import com.prismTax.simulator.collaborator.dto.DocumentOcrRequest;
import com.prismTax.simulator.collaborator.dto.DocumentOcrResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Client for the document OCR service (invoices and bank statements).
 */
@Service
public class DocumentOcrApiClient extends CollaboratorRestClient {

    public static final String DOCUMENT_EXTRACTION = "Document processing";

    public DocumentOcrApiClient(
            @Value("${collaborator.ocr.base-url:http://localhost:8090/api}") String baseUrl,
            @Value("${collaborator.ocr.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${collaborator.ocr.read-timeout-ms:30000}") int readTimeoutMs) {
        super("Document OCR API", baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    public DocumentOcrResponse extract(DocumentOcrRequest request, String correlationId) {
        return post("/ocr/extract", request, DocumentOcrResponse.class, DOCUMENT_EXTRACTION, correlationId);
    }
}
