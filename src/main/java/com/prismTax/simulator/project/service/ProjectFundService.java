package com.prismTax.simulator.project.service;

import com.prismTax.simulator.collaborator.client.ProjectFundsApiClient;
import com.prismTax.simulator.collaborator.dto.ProjectFundsRequest;
import com.prismTax.simulator.collaborator.dto.ProjectFundsResponse;
import com.prismTax.simulator.project.model.ActiveProject;
import com.prismTax.simulator.project.model.ProjectCompletion;
import com.prismTax.simulator.project.model.ProjectExpense;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Project fund lifecycle: open, spend, check balance, complete.
 *
 * The session holds the ledger; every step is mirrored to the project-funds
 * service first, so a failed call leaves the session's project untouched.
 * At most one project is active per session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectFundService {

    private final ProjectFundsApiClient projectFundsApiClient;
    private final RiskFlaggingService riskFlaggingService;
    private final ExcessTaxSchedule excessTaxSchedule;

    /**
     * Opens a project.
     *
     * @throws IllegalStateException if a project is already active
     * @throws IllegalArgumentException if the budget is not positive
     */
    public ActiveProject open(SimulatorSession session, String name, long budget, String source, String correlationId) {
        if (session.getActiveProject() != null) {
            throw new IllegalStateException("A project is already active: " + session.getActiveProject().getName());
        }
        requirePositive(budget, "budget");

        ProjectFundsResponse response = projectFundsApiClient.execute(ProjectFundsRequest.builder()
                .action(ProjectFundsRequest.ACTION_CREATE)
                .userId(session.getSessionId())
                .name(name)
                .source(source)
                .budget(budget)
                .build(), correlationId);

        ActiveProject project = ActiveProject.builder()
                .projectId(response.getProjectId() != null ? response.getProjectId() : UUID.randomUUID().toString())
                .name(name)
                .source(source)
                .budget(budget)
                .spent(0L)
                .createdAt(Instant.now())
                .build();
        session.setActiveProject(project);

        log.info("Project opened - correlationId: {}, sessionId: {}, projectId: {}, budget: {}",
                correlationId, session.getSessionId(), project.getProjectId(), budget);
        return project;
    }

    /**
     * Records an expense against the active project. The expense is risk-checked; advisories never block it.
     *
     * @throws IllegalStateException if no project is active
     * @throws IllegalArgumentException if the amount is not positive
     */
    public ProjectExpense recordExpense(SimulatorSession session, long amount, String description, String correlationId) {
        ActiveProject project = requireActive(session);
        requirePositive(amount, "amount");

        projectFundsApiClient.execute(ProjectFundsRequest.builder()
                .action(ProjectFundsRequest.ACTION_EXPENSE)
                .projectId(project.getProjectId())
                .userId(session.getSessionId())
                .amount(amount)
                .description(description)
                .build(), correlationId);

        List<String> advisories = riskFlaggingService.advisories(description, amount);
        ProjectExpense expense = ProjectExpense.builder()
                .amount(amount)
                .description(description)
                .advisories(advisories)
                .recordedAt(Instant.now())
                .build();
        project.getExpenses().add(expense);
        project.setSpent(project.getSpent() + amount);

        log.info("Project expense recorded - correlationId: {}, projectId: {}, amount: {}, balance: {}, advisories: {}",
                correlationId, project.getProjectId(), amount, project.getBalance(), advisories.size());
        return expense;
    }

    /**
     * Confirms the active project with the project-funds service and returns it.
     *
     * @throws IllegalStateException if no project is active
     */
    public ActiveProject balance(SimulatorSession session, String correlationId) {
        ActiveProject project = requireActive(session);

        ProjectFundsResponse response = projectFundsApiClient.execute(ProjectFundsRequest.builder()
                .action(ProjectFundsRequest.ACTION_SUMMARY)
                .projectId(project.getProjectId())
                .userId(session.getSessionId())
                .build(), correlationId);

        if (response.getSpent() != null && response.getSpent().longValue() != project.getSpent()) {
            log.warn("Project ledger differs from project-funds service - correlationId: {}, projectId: {}, local: {}, remote: {}",
                    correlationId, project.getProjectId(), project.getSpent(), response.getSpent());
        }
        return project;
    }

    /**
     * Completes the active project and clears it from the session, whatever the excess.
     *
     * @throws IllegalStateException if no project is active
     */
    public ProjectCompletion complete(SimulatorSession session, String correlationId) {
        ActiveProject project = requireActive(session);

        projectFundsApiClient.execute(ProjectFundsRequest.builder()
                .action(ProjectFundsRequest.ACTION_COMPLETE)
                .projectId(project.getProjectId())
                .userId(session.getSessionId())
                .build(), correlationId);

        long excess = project.getBudget() - project.getSpent();
        ProjectCompletion completion = ProjectCompletion.builder()
                .projectName(project.getName())
                .budget(project.getBudget())
                .spent(project.getSpent())
                .excess(excess)
                .tax(excessTaxSchedule.taxOn(excess))
                .build();
        session.setActiveProject(null);

        log.info("Project completed - correlationId: {}, projectId: {}, excess: {}, tax: {}",
                correlationId, project.getProjectId(), excess, completion.getTax());
        return completion;
    }

    private ActiveProject requireActive(SimulatorSession session) {
        if (session.getActiveProject() == null) {
            throw new IllegalStateException("No active project");
        }
        return session.getActiveProject();
    }

    private void requirePositive(long value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }
}
