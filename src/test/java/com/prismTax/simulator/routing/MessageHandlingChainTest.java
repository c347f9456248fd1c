package com.prismTax.simulator.routing;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.action.MetaActions;
import com.prismTax.simulator.action.ProjectActions;
import com.prismTax.simulator.action.ReliefActions;
import com.prismTax.simulator.action.TaxCalculationActions;
import com.prismTax.simulator.classifier.service.IntentClassifierService;
import com.prismTax.simulator.collaborator.client.ProjectFundsApiClient;
import com.prismTax.simulator.collaborator.dto.ProjectFundsRequest;
import com.prismTax.simulator.collaborator.dto.ProjectFundsResponse;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.grammar.CommandGrammarMatcher;
import com.prismTax.simulator.project.service.ExcessTaxSchedule;
import com.prismTax.simulator.project.service.ProjectFundService;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import com.prismTax.simulator.routing.step.CommandGrammarStep;
import com.prismTax.simulator.routing.step.DefaultReplyStep;
import com.prismTax.simulator.routing.step.IntentClassificationStep;
import com.prismTax.simulator.routing.step.ResetCommandStep;
import com.prismTax.simulator.routing.step.StateInputStep;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.session.service.RegistrationFlowService;
import com.prismTax.simulator.session.service.SeedProfileCatalog;
import com.prismTax.simulator.session.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageHandlingChain")
class MessageHandlingChainTest {

    @Mock
    private IntentClassifierService intentClassifierService;
    @Mock
    private IntentRouter intentRouter;
    @Mock
    private TaxCalculationActions taxCalculationActions;
    @Mock
    private ReliefActions reliefActions;
    @Mock
    private DocumentUploadActions documentUploadActions;
    @Mock
    private MetaActions metaActions;
    @Mock
    private ProjectFundsApiClient projectFundsApiClient;

    private final SessionService sessionService = new SessionService(30, 100);
    private MessageHandlingChain chain;

    @BeforeEach
    void setUp() {
        SimulatorPolicyProperties policy = new SimulatorPolicyProperties();
        ResponseEmitter responseEmitter = new ResponseEmitter();
        RegistrationFlowService registrationFlowService = new RegistrationFlowService(responseEmitter,
                new SeedProfileCatalog("data/seed-profiles.json"), policy);
        ProjectActions projectActions = new ProjectActions(new ProjectFundService(projectFundsApiClient,
                new RiskFlaggingService(policy), new ExcessTaxSchedule(policy)), responseEmitter);

        chain = new MessageHandlingChain(List.of(
                new ResetCommandStep(sessionService, responseEmitter),
                new StateInputStep(registrationFlowService, documentUploadActions),
                new CommandGrammarStep(new CommandGrammarMatcher(), taxCalculationActions, reliefActions,
                        projectActions, documentUploadActions, metaActions),
                new IntentClassificationStep(intentClassifierService, intentRouter, responseEmitter),
                new DefaultReplyStep(responseEmitter)), responseEmitter);
    }

    private SimulatorSession liveSession(EntityType entityType, SessionState state) {
        SimulatorSession session = sessionService.getOrCreateSession(TurnFixtures.PHONE, entityType);
        session.setState(state);
        return session;
    }

    private TurnContext send(SimulatorSession session, String text) {
        TurnContext turn = TurnFixtures.turn(session, text);
        chain.handle(turn);
        return turn;
    }

    private static String lastText(TurnContext turn) {
        List<SimulatorMessage> outgoing = turn.getOutgoing();
        return outgoing.get(outgoing.size() - 1).getText();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("an onboarding state consumes a command-shaped message before grammar and classifier")
        void stateInputBeforeGrammarAndClassifier() {
            SimulatorSession session = liveSession(EntityType.INDIVIDUAL, SessionState.AWAITING_NIN);

            TurnContext turn = send(session, "vat 50000");

            assertThat(lastText(turn)).contains("exactly 11 digits");
            assertThat(session.getState()).isEqualTo(SessionState.AWAITING_NIN);
            verifyNoInteractions(taxCalculationActions, intentClassifierService, intentRouter);
        }

        @Test
        @DisplayName("a grammar match never reaches the classifier")
        void grammarBeforeClassifier() {
            SimulatorSession session = liveSession(EntityType.BUSINESS, SessionState.REGISTERED);

            TurnContext turn = send(session, "vat 50,000 laptop");

            verify(taxCalculationActions).vat(turn, 50_000L, "laptop");
            verifyNoInteractions(intentClassifierService);
        }

        @Test
        @DisplayName("reset wins over every state")
        void resetFirst() {
            SimulatorSession session = liveSession(EntityType.INDIVIDUAL, SessionState.AWAITING_FULL_NAME);

            TurnContext turn = send(session, " RESTART ");

            assertThat(session.isDiscarded()).isTrue();
            assertThat(turn.getSession()).isSameAs(sessionService.getSession(TurnFixtures.PHONE));
            assertThat(turn.getSession().getState()).isEqualTo(SessionState.NEW);
            assertThat(turn.getSession().getEntityType()).isEqualTo(EntityType.INDIVIDUAL);
            assertThat(turn.getSession().getTranscript()).singleElement()
                    .satisfies(message -> assertThat(message.getText()).isEqualTo(BotMessageTemplates.SESSION_RESET));
            assertThat(turn.getSession().getTurnLock().isLocked()).isFalse();
        }
    }

    @Test
    @DisplayName("unmatched text the classifier cannot place gets the not-understood reply")
    void unclassifiableFallsToDefault() {
        SimulatorSession session = liveSession(EntityType.BUSINESS, SessionState.REGISTERED);
        when(intentClassifierService.classify(anyString(), anyList(), anyString())).thenReturn(Optional.empty());

        TurnContext turn = send(session, "tell me a joke");

        assertThat(turn.getOutgoing()).singleElement()
                .satisfies(message -> assertThat(message.getText()).isEqualTo(BotMessageTemplates.NOT_UNDERSTOOD));
        verifyNoInteractions(intentRouter);
    }

    @Test
    @DisplayName("typed project commands: 5,000,000 budget, ten expenses totalling 4,700,000, no tax on 300,000 excess")
    void typedProjectLifecycle() {
        when(projectFundsApiClient.execute(any(ProjectFundsRequest.class), anyString())).thenAnswer(invocation -> {
            ProjectFundsRequest request = invocation.getArgument(0);
            return ProjectFundsRequest.ACTION_CREATE.equals(request.getAction())
                    ? ProjectFundsResponse.builder().projectId("proj-1").status("active").build()
                    : ProjectFundsResponse.builder().status("ok").build();
        });
        SimulatorSession session = liveSession(EntityType.INDIVIDUAL, SessionState.REGISTERED);

        assertThat(lastText(send(session, "new project Uncle Building 5000000 from Uncle Chukwu")))
                .contains("Project created: Uncle Building")
                .contains("Source: Uncle Chukwu");

        List<String> expenses = List.of(
                "project expense 900,000 cement",
                "project expense 650,000 blocks",
                "project expense 500,000 roofing sheets",
                "project expense 450,000 plumbing",
                "project expense 400,000 tiles",
                "project expense 350,000 windows",
                "project expense 300,000 doors",
                "project expense 550,000 electrical wiring",
                "project expense 250,000 paint",
                "project expense ₦350,000 carpentry");
        TurnContext lastExpense = null;
        for (String expense : expenses) {
            lastExpense = send(session, expense);
        }

        assertThat(session.getActiveProject().getSpent()).isEqualTo(4_700_000L);
        assertThat(session.getActiveProject().getExpenses()).hasSize(10);
        assertThat(lastText(lastExpense)).contains("Balance: ₦300,000");

        assertThat(lastText(send(session, "project balance")))
                .contains("(10 expenses)")
                .contains("*Balance: ₦300,000*");

        assertThat(lastText(send(session, "complete project")))
                .contains("Unspent excess: ₦300,000")
                .contains("*Tax on excess: ₦0*");
        assertThat(session.getActiveProject()).isNull();
        verifyNoInteractions(intentClassifierService);
    }
}
