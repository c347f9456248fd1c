package com.prismTax.simulator.routing;

import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.action.ExpenseActions;
import com.prismTax.simulator.action.MenuActions;
import com.prismTax.simulator.action.MetaActions;
import com.prismTax.simulator.action.ReliefActions;
import com.prismTax.simulator.action.ReliefType;
import com.prismTax.simulator.action.StatementActions;
import com.prismTax.simulator.action.TaxCalculationActions;
import com.prismTax.simulator.classifier.model.ArtificialTransactionCheck;
import com.prismTax.simulator.classifier.model.ClassificationResult;
import com.prismTax.simulator.classifier.model.Intent;
import com.prismTax.simulator.classifier.model.IntentName;
import com.prismTax.simulator.emitter.model.IntentTrace;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Intent Router - maps a classified intent to the action that answers it.
 *
 * Responsibilities:
 * - Short-circuit to a direct calculation when a calculation intent carries an amount
 * - Dispatch every other intent through a table covering all intent names
 * - Append the classifier's artificial-transaction advisory when it is flagged
 */
@Slf4j
@Service
public class IntentRouter {

    static final String TAX_TYPE_VAT = "vat";

    private final TaxCalculationActions taxCalculationActions;
    private final ExpenseActions expenseActions;
    private final ResponseEmitter responseEmitter;
    private final Map<IntentName, IntentHandler> handlers = new EnumMap<>(IntentName.class);

    public IntentRouter(TaxCalculationActions taxCalculationActions,
                        ExpenseActions expenseActions,
                        StatementActions statementActions,
                        ReliefActions reliefActions,
                        DocumentUploadActions documentUploadActions,
                        MenuActions menuActions,
                        MetaActions metaActions,
                        ResponseEmitter responseEmitter) {
        this.taxCalculationActions = taxCalculationActions;
        this.expenseActions = expenseActions;
        this.responseEmitter = responseEmitter;

        handlers.put(IntentName.GET_TRANSACTION_SUMMARY, (turn, intent) -> statementActions.transactionSummary(turn));
        handlers.put(IntentName.GET_TAX_RELIEF_INFO, (turn, intent) -> {
            ReliefType type = ReliefType.fromText(intent.entityText("relief_type"));
            if (type != null) {
                reliefActions.showRelief(turn, type);
            } else {
                reliefActions.listReliefs(turn);
            }
        });
        handlers.put(IntentName.UPLOAD_RECEIPT, (turn, intent) -> documentUploadActions.requestUpload(turn));
        handlers.put(IntentName.CATEGORIZE_EXPENSE, (turn, intent) -> expenseActions.promptForDetails(turn));
        handlers.put(IntentName.GET_TAX_CALCULATION, (turn, intent) -> taxCalculationActions.showMenu(turn));
        handlers.put(IntentName.SET_REMINDER, (turn, intent) -> menuActions.reminderMenu(turn));
        handlers.put(IntentName.CONNECT_BANK,
                (turn, intent) -> menuActions.bankMenu(turn, intent.entityText("bank_name")));
        handlers.put(IntentName.ARTIFICIAL_TRANSACTION_WARNING, (turn, intent) ->
                expenseActions.artificialTransactionWarning(turn,
                        intent.entityText("description"), intent.entityText("category")));
        handlers.put(IntentName.VERIFY_IDENTITY,
                (turn, intent) -> menuActions.verificationMenu(turn, intent.entityText("id_type")));
        handlers.put(IntentName.ONBOARDING, (turn, intent) -> metaActions.help(turn));
        handlers.put(IntentName.GENERAL_QUERY, (turn, intent) -> metaActions.help(turn));

        for (IntentName name : IntentName.values()) {
            if (!handlers.containsKey(name)) {
                throw new IllegalStateException("No handler registered for intent: " + name);
            }
        }
    }

    public void route(TurnContext turn, ClassificationResult result) {
        Intent intent = result.getIntent();
        turn.setIntentTrace(IntentTrace.builder()
                .name(intent.getName().getWireName())
                .confidence(intent.getConfidence())
                .source(intent.getSource().getLabel())
                .build());

        log.info("Routing intent - correlationId: {}, intent: {}, confidence: {}, source: {}",
                turn.getCorrelationId(), intent.getName(), intent.getConfidence(), intent.getSource());

        if (!routeDirectCalculation(turn, intent)) {
            handlers.get(intent.getName()).handle(turn, intent);
        }

        if (result.isSuspicious()) {
            responseEmitter.text(turn, advisoryText(result.getArtificialTransactionCheck()));
        }
    }

    private boolean routeDirectCalculation(TurnContext turn, Intent intent) {
        Long amount = intent.entityAmount("amount");
        if (amount == null || amount <= 0 || !intent.getName().isCalculation()) {
            return false;
        }

        if (intent.getName() == IntentName.CATEGORIZE_EXPENSE) {
            expenseActions.categorize(turn, amount, intent.entityText("description"),
                    intent.entityText("category"), intent.entityText("project"));
            return true;
        }

        String taxType = intent.entityText("tax_type");
        if (taxType != null && TAX_TYPE_VAT.equals(taxType.toLowerCase(Locale.ROOT))) {
            taxCalculationActions.vat(turn, amount, intent.entityText("description"));
        } else {
            taxCalculationActions.incomeTaxForType(turn, intent.entityText("income_type"), amount);
        }
        return true;
    }

    private static String advisoryText(ArtificialTransactionCheck check) {
        StringBuilder text = new StringBuilder("⚠️ *Compliance Advisory*\n\n");
        text.append(check.getWarning() != null
                ? check.getWarning()
                : "This transaction may be treated as artificial and disregarded for tax purposes.");
        if (check.getActReference() != null) {
            text.append("\n\n📖 ").append(check.getActReference());
        }
        return text.toString();
    }
}
