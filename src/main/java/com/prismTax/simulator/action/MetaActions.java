package com.prismTax.simulator.action;

import com.prismTax.simulator.collaborator.client.TaxCalculationApiClient;
import com.prismTax.simulator.collaborator.dto.VatReconciliationRequest;
import com.prismTax.simulator.collaborator.dto.VatReconciliationResponse;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.CollectedProfile;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.FilingSummary;
import com.prismTax.simulator.session.model.ReliefEntry;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.statement.model.CategorizedStatement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Meta commands: help, profile, VAT filing summary and payment confirmation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetaActions {

    public static final String PAY_NOW = "pay_now";
    public static final String VIEW_DETAILS = "view_details";

    private static final DateTimeFormatter PERIOD_LABEL = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private final TaxCalculationApiClient taxCalculationApiClient;
    private final ResponseEmitter responseEmitter;

    @Value("${simulator.time-zone:Africa/Lagos}")
    private String timeZone;

    public void help(TurnContext turn) {
        responseEmitter.text(turn, BotMessageTemplates.HELP_MESSAGE);
    }

    public void profile(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        CollectedProfile profile = session.getProfile();
        StringBuilder text = new StringBuilder("👤 *Your Profile*\n\n");
        if (session.getEntityType() == EntityType.BUSINESS) {
            text.append("Type: Business\n")
                    .append("Business name: ").append(valueOrDash(profile.getBusinessName())).append('\n')
                    .append("TIN: ").append(valueOrDash(profile.getTin())).append('\n');
        } else {
            text.append("Type: Individual\n")
                    .append("Name: ").append(valueOrDash(profile.getFullName())).append('\n')
                    .append("NIN: ").append(valueOrDash(profile.getNin())).append('\n')
                    .append("Employment: ")
                    .append(profile.getEmploymentStatus() == null ? "-" : profile.getEmploymentStatus().getLabel())
                    .append('\n');
        }
        if (!profile.getAppliedReliefs().isEmpty()) {
            text.append("\n*Reliefs:*\n");
            for (ReliefEntry entry : profile.getAppliedReliefs()) {
                text.append("• ").append(entry.getType()).append(": ").append(format(entry.getAmount())).append('\n');
            }
        }
        text.append("\nConfirmed invoices: ").append(session.getConfirmedInvoices().size());
        if (session.getActiveProject() != null) {
            text.append("\nActive project: ").append(session.getActiveProject().getName());
        }
        responseEmitter.text(turn, text.toString());
    }

    /**
     * VAT filing summary for the current period from the reconciliation service.
     */
    public void summary(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        YearMonth period = YearMonth.now(Clock.system(ZoneId.of(timeZone)));

        responseEmitter.processing(turn, "📊 Preparing your VAT summary...");
        VatReconciliationResponse result;
        try {
            result = taxCalculationApiClient.reconcileVat(VatReconciliationRequest.builder()
                    .userId(session.getSessionId())
                    .period(period.toString())
                    .build(), turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        FilingSummary summary = FilingSummary.builder()
                .period(period.toString())
                .outputVat(result.getOutputVat())
                .inputVat(result.getInputVat())
                .netVat(result.getNetVat())
                .status(result.getStatus())
                .build();
        session.setLastFilingSummary(summary);

        String netLine = summary.getNetVat() != null && summary.getNetVat().signum() < 0
                ? "Net VAT: " + format(summary.getNetVat()) + " (credit carried forward)"
                : "*Net VAT payable: " + format(summary.getNetVat()) + "*";
        responseEmitter.buttons(turn, "📊 *VAT Filing Summary - " + period.format(PERIOD_LABEL) + "*\n\n"
                        + session.getProfile().displayName() + "\n\n"
                        + "Output VAT: " + format(summary.getOutputVat()) + "\n"
                        + "Input VAT: " + format(summary.getInputVat()) + "\n"
                        + netLine + "\n"
                        + "Status: " + (summary.getStatus() == null ? "pending" : summary.getStatus()) + "\n\n"
                        + "Due by the 21st of next month.",
                List.of(ReplyButton.of(PAY_NOW, "💳 Pay Now"), ReplyButton.of(VIEW_DETAILS, "📄 View Details")));
    }

    /**
     * Confirms payment of the last summary.
     */
    public void paid(TurnContext turn) {
        FilingSummary summary = turn.getSession().getLastFilingSummary();
        if (summary == null) {
            responseEmitter.text(turn, "There is no VAT filing to confirm yet. Type *summary* first.");
            return;
        }
        if (summary.isPaid()) {
            responseEmitter.text(turn, "✅ Payment for " + summary.getPeriod() + " was already confirmed.");
            return;
        }
        summary.setPaid(true);
        summary.setStatus("paid");
        log.info("VAT payment confirmed - correlationId: {}, sessionId: {}, period: {}",
                turn.getCorrelationId(), turn.getSession().getSessionId(), summary.getPeriod());
        responseEmitter.text(turn, "✅ *Payment confirmed*\n\n"
                + format(summary.getNetVat()) + " for the " + summary.getPeriod() + " VAT filing has been recorded.\n"
                + "Keep your payment receipt for your records.");
    }

    /**
     * "Pay now" button on the summary.
     */
    public void payNow(TurnContext turn) {
        FilingSummary summary = turn.getSession().getLastFilingSummary();
        if (summary == null) {
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }
        responseEmitter.text(turn, "💳 Please confirm payment of " + format(summary.getNetVat()) + " for the "
                + summary.getPeriod() + " VAT filing.\n\nReply *paid* once the transfer is done.");
    }

    /**
     * "View details" button on the summary.
     */
    public void viewDetails(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        FilingSummary summary = session.getLastFilingSummary();
        if (summary == null) {
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }
        StringBuilder text = new StringBuilder("📄 *Filing Details - ").append(summary.getPeriod()).append("*\n\n")
                .append("Confirmed invoices this session: ").append(session.getConfirmedInvoices().size()).append('\n');
        CategorizedStatement statement = session.getProcessedBankStatement();
        if (statement != null) {
            text.append("Statement output VAT: ").append(format(statement.getOutputVat())).append('\n')
                    .append("Statement input VAT: ").append(format(statement.getInputVat())).append('\n')
                    .append("Credits under review: ").append(statement.getReviewQueue().size()).append('\n');
        }
        text.append("Status: ").append(summary.isPaid() ? "paid" : valueOrDash(summary.getStatus()));
        responseEmitter.text(turn, text.toString());
    }

    private static String valueOrDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
