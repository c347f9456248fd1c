package com.prismTax.simulator.action;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.collaborator.client.ProjectFundsApiClient;
import com.prismTax.simulator.collaborator.dto.ProjectFundsRequest;
import com.prismTax.simulator.collaborator.dto.ProjectFundsResponse;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.project.service.ExcessTaxSchedule;
import com.prismTax.simulator.project.service.ProjectFundService;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import com.prismTax.simulator.session.model.SimulatorSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProjectActions")
class ProjectActionsTest {

    @Mock
    private ProjectFundsApiClient projectFundsApiClient;

    private ProjectActions projectActions;
    private SimulatorSession session;

    @BeforeEach
    void setUp() {
        SimulatorPolicyProperties policy = new SimulatorPolicyProperties();
        ProjectFundService projectFundService = new ProjectFundService(projectFundsApiClient,
                new RiskFlaggingService(policy), new ExcessTaxSchedule(policy));
        projectActions = new ProjectActions(projectFundService, new ResponseEmitter());
        session = TurnFixtures.registeredBusiness();
    }

    private static String lastText(TurnContext turn) {
        List<SimulatorMessage> outgoing = turn.getOutgoing();
        return outgoing.get(outgoing.size() - 1).getText();
    }

    @Test
    @DisplayName("5,000,000 budget with 4,700,000 spent completes with 300,000 excess and no tax")
    void fullLifecycle() {
        when(projectFundsApiClient.execute(any(ProjectFundsRequest.class), anyString())).thenAnswer(invocation -> {
            ProjectFundsRequest request = invocation.getArgument(0);
            return ProjectFundsRequest.ACTION_CREATE.equals(request.getAction())
                    ? ProjectFundsResponse.builder().projectId("proj-1").status("active").build()
                    : ProjectFundsResponse.builder().status("ok").build();
        });

        projectActions.newProject(TurnFixtures.turn(session, "new project"), "Uncle Building", 5_000_000L, "Uncle Chukwu");
        assertThat(session.getActiveProject().getProjectId()).isEqualTo("proj-1");

        TurnContext expenseTurn = TurnFixtures.turn(session, "project expense");
        projectActions.expense(expenseTurn, 4_700_000L, "cement and blocks");
        assertThat(session.getActiveProject().getSpent()).isEqualTo(4_700_000L);
        assertThat(lastText(expenseTurn)).contains("Balance: ₦300,000");

        TurnContext balanceTurn = TurnFixtures.turn(session, "project balance");
        projectActions.balance(balanceTurn);
        assertThat(lastText(balanceTurn)).contains("*Balance: ₦300,000*");

        TurnContext completeTurn = TurnFixtures.turn(session, "complete project");
        projectActions.complete(completeTurn);
        assertThat(lastText(completeTurn))
                .contains("Unspent excess: ₦300,000")
                .contains("*Tax on excess: ₦0*");
        assertThat(session.getActiveProject()).isNull();
    }

    @Test
    @DisplayName("a second project is refused while one is active")
    void secondProjectRefused() {
        when(projectFundsApiClient.execute(any(ProjectFundsRequest.class), anyString()))
                .thenReturn(ProjectFundsResponse.builder().projectId("proj-1").build());
        projectActions.newProject(TurnFixtures.turn(session, "new project"), "House", 1_000_000L, "Dad");

        TurnContext second = TurnFixtures.turn(session, "new project");
        projectActions.newProject(second, "Shop", 2_000_000L, "Mum");

        assertThat(session.getActiveProject().getName()).isEqualTo("House");
        assertThat(lastText(second)).contains("is still active");
    }

    @Test
    @DisplayName("collaborator failure leaves the ledger unchanged")
    void failureLeavesLedgerUnchanged() {
        when(projectFundsApiClient.execute(any(ProjectFundsRequest.class), anyString()))
                .thenReturn(ProjectFundsResponse.builder().projectId("proj-1").build())
                .thenThrow(new CollaboratorCallException(ProjectFundsApiClient.PROJECT_UPDATE, "timeout"));
        projectActions.newProject(TurnFixtures.turn(session, "new project"), "House", 1_000_000L, "Dad");

        TurnContext expenseTurn = TurnFixtures.turn(session, "project expense");
        projectActions.expense(expenseTurn, 400_000L, "roofing");

        assertThat(session.getActiveProject().getSpent()).isZero();
        assertThat(expenseTurn.getOutgoing().get(0).isPlaceholder()).isTrue();
        assertThat(lastText(expenseTurn)).isEqualTo("⚠️ Project update failed. Please try again in a moment.");
    }

    @Test
    @DisplayName("risky expenses are recorded with advisories")
    void riskyExpenseRecordedWithAdvisory() {
        when(projectFundsApiClient.execute(any(ProjectFundsRequest.class), anyString()))
                .thenReturn(ProjectFundsResponse.builder().projectId("proj-1").build());
        projectActions.newProject(TurnFixtures.turn(session, "new project"), "House", 5_000_000L, "Dad");

        TurnContext expenseTurn = TurnFixtures.turn(session, "project expense");
        projectActions.expense(expenseTurn, 600_000L, "cash for workers");

        assertThat(session.getActiveProject().getSpent()).isEqualTo(600_000L);
        assertThat(lastText(expenseTurn)).contains("Large cash-based expense");
    }

    @Test
    void expenseWithoutProject() {
        TurnContext turn = TurnFixtures.turn(session, "project expense");
        projectActions.expense(turn, 1_000L, "nails");

        assertThat(lastText(turn)).contains("no active project");
    }
}
