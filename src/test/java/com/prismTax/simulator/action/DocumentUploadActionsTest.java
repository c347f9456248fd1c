package com.prismTax.simulator.action;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.collaborator.client.DocumentOcrApiClient;
import com.prismTax.simulator.collaborator.dto.DocumentOcrRequest;
import com.prismTax.simulator.collaborator.dto.DocumentOcrResponse;
import com.prismTax.simulator.collaborator.dto.DocumentType;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.RenderKind;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.statement.model.StatementTransaction;
import com.prismTax.simulator.statement.service.BankStatementCategorizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentUploadActions")
class DocumentUploadActionsTest {

    @Mock
    private DocumentOcrApiClient documentOcrApiClient;

    private DocumentUploadActions actions;
    private SimulatorSession session;

    @BeforeEach
    void setUp() {
        SimulatorPolicyProperties policy = new SimulatorPolicyProperties();
        ResponseEmitter emitter = new ResponseEmitter();
        actions = new DocumentUploadActions(documentOcrApiClient,
                new BankStatementCategorizer(policy, new RiskFlaggingService(policy)),
                new StatementActions(emitter), emitter);
        session = TurnFixtures.registeredBusiness();
    }

    private static DocumentOcrResponse extractedInvoice() {
        return DocumentOcrResponse.builder()
                .documentType(DocumentType.INVOICE)
                .invoice(DocumentOcrResponse.InvoiceFields.builder()
                        .vendor("Slot Systems Ltd")
                        .invoiceNumber("INV-0042")
                        .lineItems(List.of(new DocumentOcrResponse.LineItem("Laptop", new BigDecimal("450000"))))
                        .subtotal(new BigDecimal("450000"))
                        .vatAmount(new BigDecimal("33750"))
                        .total(new BigDecimal("483750"))
                        .build())
                .build();
    }

    private void holdInvoice() {
        when(documentOcrApiClient.extract(any(DocumentOcrRequest.class), anyString())).thenReturn(extractedInvoice());
        actions.processUpload(TurnFixtures.turn(session, "📎 invoice.jpg"), DocumentType.INVOICE, "aW1hZ2U=");
    }

    @Nested
    @DisplayName("invoice confirmation")
    class InvoiceConfirmation {

        @Test
        @DisplayName("an extracted invoice waits for confirmation")
        void waitsForConfirmation() {
            holdInvoice();

            assertThat(session.getState()).isEqualTo(SessionState.AWAITING_INVOICE_CONFIRMATION);
            assertThat(session.getPendingInvoice().getVendor()).isEqualTo("Slot Systems Ltd");
        }

        @Test
        @DisplayName("only confirm or edit leaves the confirmation state")
        void otherRepliesReprompt() {
            holdInvoice();
            TurnContext turn = TurnFixtures.turn(session, "vat 50000 electronics");

            actions.handleConfirmationReply(turn);

            assertThat(session.getState()).isEqualTo(SessionState.AWAITING_INVOICE_CONFIRMATION);
            assertThat(session.getPendingInvoice()).isNotNull();
            assertThat(turn.getOutgoing()).singleElement()
                    .satisfies(message -> {
                        assertThat(message.getRenderKind()).isEqualTo(RenderKind.BUTTON_CHOICE);
                        assertThat(message.getText()).isEqualTo(BotMessageTemplates.INVOICE_CONFIRM_REPROMPT);
                    });
        }

        @Test
        void confirmStoresInvoice() {
            holdInvoice();

            actions.handleConfirmationReply(TurnFixtures.turn(session, " Confirm "));

            assertThat(session.getState()).isEqualTo(SessionState.REGISTERED);
            assertThat(session.getPendingInvoice()).isNull();
            assertThat(session.getConfirmedInvoices()).hasSize(1);
        }

        @Test
        void editDiscardsInvoice() {
            holdInvoice();

            actions.handleConfirmationReply(TurnFixtures.turn(session, "edit"));

            assertThat(session.getState()).isEqualTo(SessionState.REGISTERED);
            assertThat(session.getPendingInvoice()).isNull();
            assertThat(session.getConfirmedInvoices()).isEmpty();
        }

        @Test
        @DisplayName("a stale confirm button is rejected")
        void staleConfirmButton() {
            TurnContext turn = TurnFixtures.turn(session, DocumentUploadActions.CONFIRM_INVOICE);

            actions.confirmInvoice(turn);

            assertThat(session.getConfirmedInvoices()).isEmpty();
            assertThat(turn.getOutgoing().get(0).getText()).isEqualTo(BotMessageTemplates.OPTION_UNAVAILABLE);
        }
    }

    @Test
    @DisplayName("bank statement replaces the processed statement and returns to REGISTERED")
    void bankStatementUpload() {
        session.setState(SessionState.AWAITING_INVOICE_UPLOAD);
        when(documentOcrApiClient.extract(any(DocumentOcrRequest.class), anyString()))
                .thenReturn(DocumentOcrResponse.builder()
                        .documentType(DocumentType.BANK_STATEMENT)
                        .transactions(List.of(StatementTransaction.builder()
                                .description("NIP TRANSFER FROM CLIENT").credit(new BigDecimal("600000")).build()))
                        .build());
        TurnContext turn = TurnFixtures.turn(session, "📎 statement.png");

        actions.processUpload(turn, DocumentType.BANK_STATEMENT, "aW1hZ2U=");

        assertThat(session.getState()).isEqualTo(SessionState.REGISTERED);
        assertThat(session.getProcessedBankStatement().getOutputVat()).isEqualByComparingTo("45000");
        assertThat(session.getProcessedBankStatement().getReviewQueue()).hasSize(1);
    }

    @Test
    @DisplayName("OCR failure keeps the pre-call state")
    void ocrFailure() {
        session.setState(SessionState.AWAITING_INVOICE_UPLOAD);
        when(documentOcrApiClient.extract(any(DocumentOcrRequest.class), anyString()))
                .thenThrow(new CollaboratorCallException(DocumentOcrApiClient.DOCUMENT_EXTRACTION, "timeout"));
        TurnContext turn = TurnFixtures.turn(session, "📎 invoice.jpg");

        actions.processUpload(turn, DocumentType.INVOICE, "aW1hZ2U=");

        assertThat(session.getState()).isEqualTo(SessionState.AWAITING_INVOICE_UPLOAD);
        assertThat(session.getPendingInvoice()).isNull();
        assertThat(turn.getOutgoing()).last()
                .extracting(SimulatorMessage::getText)
                .isEqualTo("⚠️ Document processing failed. Please try again in a moment.");
    }

    @Test
    @DisplayName("uploads are refused before registration")
    void uploadBeforeRegistration() {
        SimulatorSession unregistered = TurnFixtures.session(EntityType.INDIVIDUAL, SessionState.AWAITING_NIN);
        TurnContext turn = TurnFixtures.turn(unregistered, "📎 invoice.jpg");

        actions.processUpload(turn, DocumentType.INVOICE, "aW1hZ2U=");

        assertThat(turn.getOutgoing().get(0).getText()).isEqualTo(BotMessageTemplates.UPLOAD_NOT_ALLOWED);
        verifyNoInteractions(documentOcrApiClient);
    }
}
