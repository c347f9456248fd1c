package com.prismTax.simulator.classifier.service;

import com.prismTax.simulator.classifier.dto.NluClassifyRequest;
import com.prismTax.simulator.classifier.dto.NluClassifyResponse;
import com.prismTax.simulator.collaborator.client.CollaboratorRestClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Client for the external intent classifier.
 */
@Service
public class NluApiClient extends CollaboratorRestClient {

    public static final String INTENT_CLASSIFICATION = "Intent classification";

    public NluApiClient(
            @Value("${collaborator.nlu.base-url:http://localhost:8091/nlu}") String baseUrl,
            @Value("${collaborator.nlu.connect-timeout-ms:2000}") int connectTimeoutMs,
            @Value("${collaborator.nlu.read-timeout-ms:8000}") int readTimeoutMs) {
        super("NLU classifier", baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    public NluClassifyResponse classify(NluClassifyRequest request, String correlationId) {
        return post("/classify", request, NluClassifyResponse.class, INTENT_CLASSIFICATION, correlationId);
    }
}
