package com.prismTax.simulator.collaborator.client;

import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Base for the JSON-over-HTTP collaborator clients.
 *
 * Handles HTTP communication shared by every collaborator:
 * - lazy RestClient creation with connect / read timeouts
 * - correlation ID propagation
 * - mapping of error statuses, empty bodies and transport failures to {@link CollaboratorCallException}
 */
@Slf4j
public abstract class CollaboratorRestClient {

    private final String collaboratorName;
    private final String baseUrl;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private RestClient restClient;

    protected CollaboratorRestClient(String collaboratorName, String baseUrl, int connectTimeoutMs, int readTimeoutMs) {
        this.collaboratorName = collaboratorName;
        this.baseUrl = baseUrl;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Gets or initializes the RestClient instance.
     */
    private synchronized RestClient getRestClient() {
        if (restClient == null) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeoutMs);
            requestFactory.setReadTimeout(readTimeoutMs);

            this.restClient = RestClient.builder()
                    .baseUrl(baseUrl)
                    .requestFactory(requestFactory)
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        }
        return restClient;
    }

    /**
     * POSTs a JSON body and reads a JSON response.
     *
     * @param path path relative to the base URL
     * @param body request body
     * @param responseType response class
     * @param operation user-facing label for failure messages
     * @param correlationId correlation ID for logging
     * @return deserialized response, never null
     * @throws CollaboratorCallException on error status, empty body or transport failure
     */
    protected <T> T post(String path, Object body, Class<T> responseType, String operation, String correlationId) {
        log.info("Calling {} - correlationId: {}, path: {}", collaboratorName, correlationId, path);

        try {
            T response = getRestClient().post()
                    .uri(path)
                    .header("X-Correlation-Id", correlationId)
                    .body(body)
                    .retrieve()
                    .onStatus(status -> status.isError(), (req, res) -> {
                        log.error("{} error - correlationId: {}, path: {}, status: {}",
                                collaboratorName, correlationId, path, res.getStatusCode());
                        throw new CollaboratorCallException(operation,
                                collaboratorName + " call failed with status: " + res.getStatusCode());
                    })
                    .body(responseType);

            if (response == null) {
                throw new CollaboratorCallException(operation, collaboratorName + " returned an empty response");
            }

            log.info("{} call successful - correlationId: {}, path: {}", collaboratorName, correlationId, path);
            return response;

        } catch (CollaboratorCallException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error calling {} - correlationId: {}, path: {}, error: {}",
                    collaboratorName, correlationId, path, e.getMessage(), e);
            throw new CollaboratorCallException(operation,
                    "Failed to call " + collaboratorName + ": " + e.getMessage(), e);
        }
    }
}
