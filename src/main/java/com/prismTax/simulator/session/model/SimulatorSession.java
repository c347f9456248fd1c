package com.prismTax.simulator.session.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.project.model.ActiveProject;
import com.prismTax.simulator.statement.model.CategorizedStatement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Simulator session - the full mutable state of one simulated conversation.
 *
 * Scoped to the simulated phone number. Only the turn holding {@link #turnLock}
 * mutates it. A reset never clears a session in place: the gateway marks it
 * discarded and replaces it, so a turn still in flight writes into an orphan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulatorSession {

    /**
     * Unique session ID (UUID), regenerated on every reset.
     */
    private String sessionId;

    /**
     * Simulated WhatsApp number this session belongs to.
     */
    private String phoneNumber;

    /**
     * Chosen when the session starts; changing it resets the session.
     */
    private EntityType entityType;

    @Builder.Default
    private SessionState state = SessionState.NEW;

    @Builder.Default
    private CollectedProfile profile = new CollectedProfile();

    /**
     * Sliding window of recent turns forwarded to the intent classifier.
     */
    @Builder.Default
    private List<ConversationTurn> conversationWindow = new ArrayList<>();

    /**
     * Every user and bot message of this session, in delivery order.
     * Copy-on-write so transcript reads never wait for the turn lock.
     */
    @Builder.Default
    @ToString.Exclude
    private List<SimulatorMessage> transcript = new CopyOnWriteArrayList<>();

    /**
     * Present only while state is AWAITING_INVOICE_CONFIRMATION.
     */
    private PendingInvoice pendingInvoice;

    @Builder.Default
    private List<PendingInvoice> confirmedInvoices = new ArrayList<>();

    private ActiveProject activeProject;

    /**
     * Most recent categorized bank statement; replaced wholesale on each upload.
     */
    private CategorizedStatement processedBankStatement;

    private FilingSummary lastFilingSummary;

    private Instant createdAt;

    private Instant lastAccessedAt;

    /**
     * Set once the session has been replaced by a reset. Results for a discarded session are dropped.
     */
    private volatile boolean discarded;

    /**
     * Fair lock so queued turns run in arrival order.
     */
    @JsonIgnore
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ReentrantLock turnLock = new ReentrantLock(true);

    /**
     * Updates the last accessed timestamp to now.
     */
    public void touch() {
        this.lastAccessedAt = Instant.now();
    }

    /**
     * Moves the session to AWAITING_INVOICE_CONFIRMATION holding the given invoice.
     */
    public void awaitInvoiceConfirmation(PendingInvoice invoice) {
        this.pendingInvoice = invoice;
        this.state = SessionState.AWAITING_INVOICE_CONFIRMATION;
    }

    /**
     * Leaves AWAITING_INVOICE_CONFIRMATION, dropping the pending invoice.
     *
     * @return the invoice that was pending, or null
     */
    public PendingInvoice releasePendingInvoice() {
        PendingInvoice invoice = this.pendingInvoice;
        this.pendingInvoice = null;
        this.state = SessionState.REGISTERED;
        return invoice;
    }
}
