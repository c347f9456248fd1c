package com.prismTax.simulator.routing;

import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.action.MenuActions;
import com.prismTax.simulator.action.MetaActions;
import com.prismTax.simulator.action.ReliefActions;
import com.prismTax.simulator.action.ReliefType;
import com.prismTax.simulator.action.StatementActions;
import com.prismTax.simulator.action.TaxCalculationActions;
import com.prismTax.simulator.emitter.model.IntentTrace;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.EmploymentStatus;
import com.prismTax.simulator.session.service.RegistrationFlowService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Routes button and list selections by ID, bypassing the grammar and the classifier.
 *
 * Employment buttons are accepted during registration; every other button needs a registered session.
 * Unknown IDs, or buttons pressed in the wrong state, answer "option no longer available".
 */
@Slf4j
@Service
public class ButtonSelectionRouter {

    static final String BUTTON_SOURCE = "button";

    private final RegistrationFlowService registrationFlowService;
    private final ResponseEmitter responseEmitter;
    private final Map<String, Consumer<TurnContext>> routes = new HashMap<>();

    public ButtonSelectionRouter(TaxCalculationActions taxCalculationActions,
                                 ReliefActions reliefActions,
                                 MenuActions menuActions,
                                 DocumentUploadActions documentUploadActions,
                                 MetaActions metaActions,
                                 StatementActions statementActions,
                                 RegistrationFlowService registrationFlowService,
                                 ResponseEmitter responseEmitter) {
        this.registrationFlowService = registrationFlowService;
        this.responseEmitter = responseEmitter;

        for (ReliefType type : ReliefType.values()) {
            routes.put(type.getButtonId(), turn -> reliefActions.showRelief(turn, type));
        }
        for (String calcId : new String[] {
                TaxCalculationActions.CALC_VAT_STANDARD, TaxCalculationActions.CALC_INCOME_TAX,
                TaxCalculationActions.CALC_FREELANCE, TaxCalculationActions.CALC_PENSION,
                TaxCalculationActions.CALC_RENTAL, TaxCalculationActions.CALC_MIN_WAGE}) {
            routes.put(calcId, turn -> taxCalculationActions.promptFor(turn, calcId));
        }
        for (MenuActions.Bank bank : MenuActions.Bank.values()) {
            routes.put(bank.getButtonId(), turn -> menuActions.connectBank(turn, bank));
        }
        for (String verifyId : new String[] {MenuActions.VERIFY_NIN, MenuActions.VERIFY_TIN, MenuActions.VERIFY_CAC}) {
            routes.put(verifyId, turn -> menuActions.verificationPrompt(turn, verifyId));
        }
        for (String reminderId : new String[] {
                MenuActions.REMINDER_VAT, MenuActions.REMINDER_PAYE, MenuActions.REMINDER_ANNUAL}) {
            routes.put(reminderId, turn -> menuActions.setReminder(turn, reminderId));
        }
        routes.put(DocumentUploadActions.CONFIRM_INVOICE, documentUploadActions::confirmInvoice);
        routes.put(DocumentUploadActions.EDIT_INVOICE, documentUploadActions::discardInvoice);
        routes.put(MetaActions.PAY_NOW, metaActions::payNow);
        routes.put(MetaActions.VIEW_DETAILS, metaActions::viewDetails);
        routes.put(StatementActions.VIEW_REVIEW_QUEUE, statementActions::showReviewQueue);
    }

    public void route(TurnContext turn, String buttonId) {
        turn.setIntentTrace(IntentTrace.builder()
                .name(buttonId)
                .confidence(1.0)
                .source(BUTTON_SOURCE)
                .build());

        EmploymentStatus employmentStatus = EmploymentStatus.fromButtonId(buttonId);
        if (employmentStatus != null) {
            registrationFlowService.selectEmploymentStatus(turn, employmentStatus);
            return;
        }

        Consumer<TurnContext> route = routes.get(buttonId);
        if (route == null || !turn.getSession().getState().isCommandZone()) {
            log.info("Button unavailable - correlationId: {}, buttonId: {}, state: {}",
                    turn.getCorrelationId(), buttonId, turn.getSession().getState());
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }

        log.info("Button selected - correlationId: {}, buttonId: {}", turn.getCorrelationId(), buttonId);
        route.accept(turn);
    }
}
