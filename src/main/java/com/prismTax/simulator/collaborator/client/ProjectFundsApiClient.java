package com.prismTax.simulator.collaborator.client;

import com.prismTax.simulator.collaborator.dto.ProjectFundsRequest;
import com.prismTax.simulator.collaborator.dto.ProjectFundsResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Client for the project-funds service, which persists project budgets and expenses.
 * Every request is routed to {@code /projects/{action}}.
 */
@Service
public class ProjectFundsApiClient extends CollaboratorRestClient {

    public static final String PROJECT_UPDATE = "Project update";

    public ProjectFundsApiClient(
            @Value("${collaborator.project-funds.base-url:http://localhost:8090/api}") String baseUrl,
            @Value("${collaborator.project-funds.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${collaborator.project-funds.read-timeout-ms:10000}") int readTimeoutMs) {
        super("Project funds API", baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    public ProjectFundsResponse execute(ProjectFundsRequest request, String correlationId) {
        return post("/projects/" + request.getAction(), request, ProjectFundsResponse.class,
                PROJECT_UPDATE, correlationId);
    }
}
