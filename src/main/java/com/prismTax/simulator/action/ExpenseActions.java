package com.prismTax.simulator.action;

import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Expense categorization replies. Every categorized expense goes through the risk heuristic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpenseActions {

    private static final String DEFAULT_CATEGORY = "business expense";

    private final RiskFlaggingService riskFlaggingService;
    private final ResponseEmitter responseEmitter;

    /**
     * Categorizes an expense the classifier extracted with an amount.
     *
     * @param description what was bought, may be null
     * @param category claimed category, may be null
     * @param project project the expense is tagged to, may be null
     */
    public void categorize(TurnContext turn, long amount, String description, String category, String project) {
        String label = category != null ? category : DEFAULT_CATEGORY;
        List<String> advisories = riskFlaggingService.advisories(description, amount);

        StringBuilder text = new StringBuilder("🏷️ *Expense Categorized*\n\n")
                .append("Amount: ").append(format(amount)).append('\n');
        if (description != null) {
            text.append("Description: ").append(description).append('\n');
        }
        text.append("Category: ").append(label);
        if (project != null) {
            text.append("\nProject: ").append(project);
        }
        for (String advisory : advisories) {
            text.append("\n\n").append(advisory);
        }
        if (advisories.isEmpty()) {
            text.append("\n\n✅ Keep the receipt to support this expense.");
        }

        log.info("Expense categorized - correlationId: {}, amount: {}, category: {}, advisories: {}",
                turn.getCorrelationId(), amount, label, advisories.size());
        responseEmitter.text(turn, text.toString());
    }

    /**
     * Categorization request without an amount.
     */
    public void promptForDetails(TurnContext turn) {
        responseEmitter.text(turn, "🏷️ Tell me the amount and what the expense was for, "
                + "e.g. *categorize 250000 generator repair as business*.\n\n"
                + "For a project, use *project expense <amount> <description>*.");
    }

    /**
     * Reply for a classifier-detected personal item claimed as a business cost.
     */
    public void artificialTransactionWarning(TurnContext turn, String item, String claimedCategory) {
        responseEmitter.text(turn, "⚠️ *SECTION 191 ALERT*\n\n"
                + (item != null ? "\"" + item + "\"" : "This item")
                + " looks like a personal expense"
                + (claimedCategory != null ? " claimed as " + claimedCategory : "")
                + ".\n\nArrangements that disguise personal spending as business costs can be disregarded "
                + "and the tax recomputed. Only claim expenses incurred wholly for the business.");
    }
}
