package com.prismTax.simulator.action;

import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.statement.model.CategorizedStatement;
import com.prismTax.simulator.statement.model.CategorizedTransaction;
import com.prismTax.simulator.statement.model.StatementTransaction;
import com.prismTax.simulator.statement.model.TransactionCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Replies built from the most recently processed bank statement.
 */
@Service
@RequiredArgsConstructor
public class StatementActions {

    public static final String VIEW_REVIEW_QUEUE = "view_review_queue";

    private final ResponseEmitter responseEmitter;

    /**
     * Full report sent right after a statement has been categorized.
     */
    public void report(TurnContext turn, CategorizedStatement statement) {
        StringBuilder text = new StringBuilder("🏦 *Bank Statement Analysis*\n\n")
                .append("Transactions: ").append(statement.getTransactions().size()).append("\n\n")
                .append(categoryTotals(statement))
                .append('\n')
                .append(vatExposure(statement));

        if (statement.getReviewQueue().isEmpty()) {
            responseEmitter.text(turn, text.toString().trim());
            return;
        }
        text.append("\n\n⚠️ ").append(statement.getReviewQueue().size())
                .append(" large credit(s) need review - confirm whether they are sales or personal transfers.");
        responseEmitter.buttons(turn, text.toString(),
                List.of(ReplyButton.of(VIEW_REVIEW_QUEUE, "🔍 Review credits")));
    }

    /**
     * Summary for the transaction-summary intent; nudges an upload when no statement was processed.
     */
    public void transactionSummary(TurnContext turn) {
        CategorizedStatement statement = turn.getSession().getProcessedBankStatement();
        if (statement == null) {
            responseEmitter.text(turn, "📊 No transactions yet.\n\nType *upload* and send a bank statement "
                    + "so I can categorize your transactions.");
            return;
        }
        responseEmitter.text(turn, ("📊 *Transaction Summary*\n\n" + categoryTotals(statement)).trim());
    }

    public void showReviewQueue(TurnContext turn) {
        CategorizedStatement statement = turn.getSession().getProcessedBankStatement();
        if (statement == null || statement.getReviewQueue().isEmpty()) {
            responseEmitter.text(turn, "✅ Nothing to review. No large credits are waiting for confirmation.");
            return;
        }
        StringBuilder text = new StringBuilder("🔍 *Credits to Review*\n\n");
        for (CategorizedTransaction entry : statement.getReviewQueue()) {
            StatementTransaction line = entry.getTransaction();
            text.append("• ").append(line.getDate() == null ? "" : line.getDate() + " ")
                    .append(line.getDescription()).append(": ").append(format(line.getCredit()))
                    .append("\n  ").append(entry.getRiskFlag()).append('\n');
        }
        text.append("\nThese were counted as sales for VAT. Keep evidence of the source of funds.");
        responseEmitter.text(turn, text.toString());
    }

    private String categoryTotals(CategorizedStatement statement) {
        StringBuilder text = new StringBuilder("*Money in:* ").append(format(statement.getTotalCredits())).append('\n');
        for (TransactionCategory category : TransactionCategory.values()) {
            BigDecimal total = statement.creditTotal(category);
            if (total.signum() != 0) {
                text.append("• ").append(category.getLabel()).append(": ").append(format(total)).append('\n');
            }
        }
        text.append("*Money out:* ").append(format(statement.getTotalDebits())).append('\n');
        for (TransactionCategory category : TransactionCategory.values()) {
            BigDecimal total = statement.debitTotal(category);
            if (total.signum() != 0) {
                text.append("• ").append(category.getLabel()).append(": ").append(format(total)).append('\n');
            }
        }
        long flagged = statement.getTransactions().stream()
                .filter(entry -> entry.getTransaction().hasDebit() && entry.getRiskFlag() != null)
                .count();
        if (flagged > 0) {
            text.append("⚠️ ").append(flagged).append(" expense(s) flagged for documentation\n");
        }
        return text.toString();
    }

    private String vatExposure(CategorizedStatement statement) {
        BigDecimal net = statement.getNetVat();
        return "*VAT position*\n"
                + "Output VAT: " + format(statement.getOutputVat()) + "\n"
                + "Input VAT: " + format(statement.getInputVat()) + "\n"
                + (net.signum() < 0
                        ? "Net VAT: " + format(net) + " (credit carried forward)"
                        : "*Net VAT payable: " + format(net) + "*");
    }
}
