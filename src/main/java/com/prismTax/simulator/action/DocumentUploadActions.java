package com.prismTax.simulator.action;

import com.prismTax.simulator.collaborator.client.DocumentOcrApiClient;
import com.prismTax.simulator.collaborator.dto.DocumentOcrRequest;
import com.prismTax.simulator.collaborator.dto.DocumentOcrResponse;
import com.prismTax.simulator.collaborator.dto.DocumentType;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.PendingInvoice;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.statement.model.CategorizedStatement;
import com.prismTax.simulator.statement.service.BankStatementCategorizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Document upload flow.
 *
 * Responsibilities:
 * - Move to AWAITING_INVOICE_UPLOAD on request
 * - Send uploaded images to OCR
 * - Hold an extracted invoice until the user confirms or discards it
 * - Categorize extracted bank statements, replacing the previous statement
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentUploadActions {

    public static final String CONFIRM_INVOICE = "confirm_invoice";
    public static final String EDIT_INVOICE = "edit_invoice";

    private static final Set<String> CONFIRM_REPLIES = Set.of("confirm", "yes", "y");
    private static final Set<String> EDIT_REPLIES = Set.of("edit", "no", "n");

    private final DocumentOcrApiClient documentOcrApiClient;
    private final BankStatementCategorizer bankStatementCategorizer;
    private final StatementActions statementActions;
    private final ResponseEmitter responseEmitter;

    /**
     * Handles the "upload" command or upload intent.
     */
    public void requestUpload(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (!session.getState().acceptsUpload()) {
            responseEmitter.text(turn, BotMessageTemplates.UPLOAD_NOT_ALLOWED);
            return;
        }
        session.setState(SessionState.AWAITING_INVOICE_UPLOAD);
        responseEmitter.text(turn, BotMessageTemplates.UPLOAD_PROMPT);
    }

    /**
     * Processes an uploaded document image.
     */
    public void processUpload(TurnContext turn, DocumentType documentType, String imageBase64) {
        SimulatorSession session = turn.getSession();
        if (!session.getState().acceptsUpload()) {
            responseEmitter.text(turn, BotMessageTemplates.UPLOAD_NOT_ALLOWED);
            return;
        }

        responseEmitter.processing(turn, documentType == DocumentType.INVOICE
                ? "📄 Reading your invoice..." : "🏦 Reading your bank statement...");

        DocumentOcrResponse extraction;
        try {
            extraction = documentOcrApiClient.extract(DocumentOcrRequest.builder()
                    .image(imageBase64)
                    .documentType(documentType)
                    .build(), turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        if (documentType == DocumentType.INVOICE) {
            holdInvoice(turn, extraction);
        } else {
            categorizeStatement(turn, extraction);
        }
    }

    /**
     * Consumes a typed reply while an invoice waits for confirmation. Anything but confirm / edit re-prompts.
     */
    public void handleConfirmationReply(TurnContext turn) {
        String reply = turn.normalizedText();
        if (CONFIRM_REPLIES.contains(reply)) {
            confirmInvoice(turn);
        } else if (EDIT_REPLIES.contains(reply)) {
            discardInvoice(turn);
        } else {
            responseEmitter.buttons(turn, BotMessageTemplates.INVOICE_CONFIRM_REPROMPT, confirmationButtons());
        }
    }

    public void confirmInvoice(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (session.getState() != SessionState.AWAITING_INVOICE_CONFIRMATION) {
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }
        PendingInvoice invoice = session.releasePendingInvoice();
        session.getConfirmedInvoices().add(invoice);
        log.info("Invoice confirmed - correlationId: {}, sessionId: {}, confirmedInvoices: {}",
                turn.getCorrelationId(), session.getSessionId(), session.getConfirmedInvoices().size());
        responseEmitter.text(turn, BotMessageTemplates.INVOICE_CONFIRMED);
    }

    public void discardInvoice(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (session.getState() != SessionState.AWAITING_INVOICE_CONFIRMATION) {
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }
        session.releasePendingInvoice();
        log.info("Invoice discarded - correlationId: {}, sessionId: {}", turn.getCorrelationId(), session.getSessionId());
        responseEmitter.text(turn, BotMessageTemplates.INVOICE_DISCARDED);
    }

    private void holdInvoice(TurnContext turn, DocumentOcrResponse extraction) {
        DocumentOcrResponse.InvoiceFields fields = extraction.getInvoice();
        if (fields == null) {
            responseEmitter.text(turn, "❌ I couldn't find invoice details in that image. "
                    + "Please upload a clearer photo.");
            return;
        }

        PendingInvoice invoice = PendingInvoice.builder()
                .vendor(fields.getVendor())
                .invoiceNumber(fields.getInvoiceNumber())
                .invoiceDate(fields.getDate())
                .lineItems(fields.getLineItems() == null ? List.of() : fields.getLineItems().stream()
                        .map(item -> new PendingInvoice.LineItem(item.getDescription(), item.getAmount()))
                        .toList())
                .subtotal(fields.getSubtotal())
                .vatAmount(fields.getVatAmount())
                .total(fields.getTotal())
                .classification(fields.getClassification())
                .build();
        turn.getSession().awaitInvoiceConfirmation(invoice);

        StringBuilder text = new StringBuilder("📄 *Invoice Extracted*\n\n");
        if (invoice.getVendor() != null) {
            text.append("Vendor: ").append(invoice.getVendor()).append('\n');
        }
        if (invoice.getInvoiceNumber() != null) {
            text.append("Invoice #: ").append(invoice.getInvoiceNumber()).append('\n');
        }
        if (invoice.getInvoiceDate() != null) {
            text.append("Date: ").append(invoice.getInvoiceDate()).append('\n');
        }
        for (PendingInvoice.LineItem item : invoice.getLineItems()) {
            text.append("• ").append(item.getDescription()).append(": ").append(format(item.getAmount())).append('\n');
        }
        text.append("\nSubtotal: ").append(format(invoice.getSubtotal())).append('\n')
                .append("VAT: ").append(format(invoice.getVatAmount())).append('\n')
                .append("*Total: ").append(format(invoice.getTotal())).append("*\n");
        if (invoice.getClassification() != null) {
            text.append("Classification: ").append(invoice.getClassification()).append('\n');
        }
        text.append("\nIs this correct?");

        responseEmitter.buttons(turn, text.toString(), confirmationButtons());
    }

    private void categorizeStatement(TurnContext turn, DocumentOcrResponse extraction) {
        CategorizedStatement statement;
        try {
            statement = bankStatementCategorizer.categorize(extraction.getTransactions());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected bank statement - correlationId: {}, error: {}", turn.getCorrelationId(), e.getMessage());
            responseEmitter.text(turn, "❌ I couldn't read that statement: " + e.getMessage()
                    + "\n\nPlease upload a clearer copy.");
            return;
        }

        SimulatorSession session = turn.getSession();
        session.setProcessedBankStatement(statement);
        session.setState(SessionState.REGISTERED);
        statementActions.report(turn, statement);
    }

    private List<ReplyButton> confirmationButtons() {
        return List.of(
                ReplyButton.of(CONFIRM_INVOICE, "✓ Confirm"),
                ReplyButton.of(EDIT_INVOICE, "✏️ Edit"));
    }
}
