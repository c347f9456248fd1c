package com.prismTax.simulator.routing.step;

import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.action.MetaActions;
import com.prismTax.simulator.action.ProjectActions;
import com.prismTax.simulator.action.ReliefActions;
import com.prismTax.simulator.action.TaxCalculationActions;
import com.prismTax.simulator.emitter.model.IntentTrace;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.grammar.CommandGrammarMatcher;
import com.prismTax.simulator.grammar.CommandMatch;
import com.prismTax.simulator.routing.MessageHandlingStep;
import com.prismTax.simulator.routing.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Explicit command grammar, active only in the registered zone. A match is dispatched directly,
 * without consulting the classifier.
 */
@Slf4j
@Component
@Order(30)
@RequiredArgsConstructor
public class CommandGrammarStep implements MessageHandlingStep {

    static final String GRAMMAR_SOURCE = "grammar";

    private final CommandGrammarMatcher commandGrammarMatcher;
    private final TaxCalculationActions taxCalculationActions;
    private final ReliefActions reliefActions;
    private final ProjectActions projectActions;
    private final DocumentUploadActions documentUploadActions;
    private final MetaActions metaActions;

    @Override
    public StepResult handle(TurnContext turn) {
        if (!turn.getSession().getState().isCommandZone()) {
            return StepResult.CONTINUE;
        }
        Optional<CommandMatch> match = commandGrammarMatcher.match(turn.getMessageText());
        if (match.isEmpty()) {
            return StepResult.CONTINUE;
        }

        CommandMatch command = match.get();
        log.info("Grammar command - correlationId: {}, sessionId: {}, command: {}",
                turn.getCorrelationId(), turn.getSession().getSessionId(), command.getCommand());
        turn.setIntentTrace(IntentTrace.builder()
                .name(command.getCommand().name().toLowerCase(Locale.ROOT))
                .confidence(1.0)
                .source(GRAMMAR_SOURCE)
                .build());
        dispatch(turn, command);
        return StepResult.HANDLED;
    }

    private void dispatch(TurnContext turn, CommandMatch match) {
        switch (match.getCommand()) {
            case HELP -> metaActions.help(turn);
            case PROFILE -> metaActions.profile(turn);
            case SUMMARY -> metaActions.summary(turn);
            case PAID -> metaActions.paid(turn);
            case UPLOAD -> documentUploadActions.requestUpload(turn);
            case LIST_RELIEFS -> reliefActions.listReliefs(turn);
            case ADD_RELIEF -> reliefActions.addRelief(turn, match.getReliefType(), match.getAmount());
            case NEW_PROJECT -> projectActions.newProject(turn, match.getName(), match.getAmount(), match.getSource());
            case PROJECT_EXPENSE -> projectActions.expense(turn, match.getAmount(), match.getDescription());
            case PROJECT_BALANCE -> projectActions.balance(turn);
            case COMPLETE_PROJECT -> projectActions.complete(turn);
            case MINIMUM_WAGE_CHECK -> taxCalculationActions.minimumWageCheck(turn, match.getAmount());
            case MIXED_PENSION_BUSINESS ->
                    taxCalculationActions.mixedIncomeTax(turn, match.getAmount(), match.getSecondAmount());
            case PENSION -> taxCalculationActions.pensionIncomeTax(turn, match.getAmount());
            case FREELANCE -> taxCalculationActions.freelanceIncomeTax(turn, match.getAmount(),
                    match.getSecondAmount() == null ? 0L : match.getSecondAmount());
            case RENTAL_INCOME -> taxCalculationActions.rentalIncome(turn, match.getAmount());
            case SIDE_HUSTLE -> taxCalculationActions.sideHustleIncomeTax(turn, match.getAmount());
            case MONTHLY_TAX -> taxCalculationActions.monthlyIncomeTax(turn, match.getAmount());
            case ANNUAL_TAX -> taxCalculationActions.annualIncomeTax(turn, match.getAmount());
            case VAT -> taxCalculationActions.vat(turn, match.getAmount(), match.getDescription());
        }
    }
}
