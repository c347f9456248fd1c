package com.prismTax.simulator.routing;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.action.MenuActions;
import com.prismTax.simulator.action.MetaActions;
import com.prismTax.simulator.action.ReliefActions;
import com.prismTax.simulator.action.ReliefType;
import com.prismTax.simulator.action.StatementActions;
import com.prismTax.simulator.action.TaxCalculationActions;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.EmploymentStatus;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.service.RegistrationFlowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ButtonSelectionRouter")
class ButtonSelectionRouterTest {

    @Mock
    private TaxCalculationActions taxCalculationActions;
    @Mock
    private ReliefActions reliefActions;
    @Mock
    private MenuActions menuActions;
    @Mock
    private DocumentUploadActions documentUploadActions;
    @Mock
    private MetaActions metaActions;
    @Mock
    private StatementActions statementActions;
    @Mock
    private RegistrationFlowService registrationFlowService;

    private ButtonSelectionRouter router;

    @BeforeEach
    void setUp() {
        router = new ButtonSelectionRouter(taxCalculationActions, reliefActions, menuActions, documentUploadActions,
                metaActions, statementActions, registrationFlowService, new ResponseEmitter());
    }

    @Test
    void reliefButton() {
        TurnContext turn = TurnFixtures.turn(TurnFixtures.registeredBusiness(), ReliefType.values()[0].getButtonId());

        router.route(turn, ReliefType.values()[0].getButtonId());

        verify(reliefActions).showRelief(turn, ReliefType.values()[0]);
        assertThat(turn.getIntentTrace().getSource()).isEqualTo("button");
    }

    @Test
    void calculatorButton() {
        TurnContext turn = TurnFixtures.turn(TurnFixtures.registeredBusiness(), TaxCalculationActions.CALC_RENTAL);

        router.route(turn, TaxCalculationActions.CALC_RENTAL);

        verify(taxCalculationActions).promptFor(turn, TaxCalculationActions.CALC_RENTAL);
    }

    @Test
    void invoiceConfirmButton() {
        TurnContext turn = TurnFixtures.turn(
                TurnFixtures.session(EntityType.BUSINESS, SessionState.AWAITING_INVOICE_CONFIRMATION),
                DocumentUploadActions.CONFIRM_INVOICE);

        router.route(turn, DocumentUploadActions.CONFIRM_INVOICE);

        verify(documentUploadActions).confirmInvoice(turn);
    }

    @Test
    @DisplayName("employment buttons go to registration even before the command zone")
    void employmentButton() {
        TurnContext turn = TurnFixtures.turn(
                TurnFixtures.session(EntityType.INDIVIDUAL, SessionState.AWAITING_EMPLOYMENT_STATUS),
                "employment_employed");

        router.route(turn, "employment_employed");

        verify(registrationFlowService).selectEmploymentStatus(turn, EmploymentStatus.EMPLOYED);
    }

    @Test
    void unknownButtonIsUnavailable() {
        TurnContext turn = TurnFixtures.turn(TurnFixtures.registeredBusiness(), "does_not_exist");

        router.route(turn, "does_not_exist");

        assertThat(turn.getOutgoing()).singleElement()
                .satisfies(message -> assertThat(message.getText()).isEqualTo(BotMessageTemplates.OPTION_UNAVAILABLE));
    }

    @Test
    @DisplayName("command buttons pressed during onboarding are unavailable")
    void commandButtonDuringOnboarding() {
        TurnContext turn = TurnFixtures.turn(
                TurnFixtures.session(EntityType.BUSINESS, SessionState.AWAITING_TIN), MetaActions.PAY_NOW);

        router.route(turn, MetaActions.PAY_NOW);

        verifyNoInteractions(metaActions);
        assertThat(turn.getOutgoing().get(0).getText()).isEqualTo(BotMessageTemplates.OPTION_UNAVAILABLE);
    }
}
