package com.prismTax.simulator.gateway.service;

import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.collaborator.dto.DocumentType;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.dto.ButtonRequest;
import com.prismTax.simulator.gateway.dto.ResetRequest;
import com.prismTax.simulator.gateway.dto.SimulatorMessageRequest;
import com.prismTax.simulator.gateway.dto.SimulatorTurnResponse;
import com.prismTax.simulator.gateway.dto.TranscriptResponse;
import com.prismTax.simulator.gateway.dto.UploadRequest;
import com.prismTax.simulator.gateway.exception.MissingPhoneNumberException;
import com.prismTax.simulator.gateway.exception.TurnInProgressException;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.gateway.util.PhoneNumberMasker;
import com.prismTax.simulator.routing.ButtonSelectionRouter;
import com.prismTax.simulator.routing.MessageHandlingChain;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.session.service.ConversationWindowService;
import com.prismTax.simulator.session.service.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Simulator gateway service - runs one simulated WhatsApp turn end to end.
 *
 * Responsibilities:
 * - Extract and validate the simulated phone number from the header
 * - Generate correlationId
 * - Serialize turns per session (fair lock, bounded wait)
 * - Record the user message, run the handling pipeline, update the classifier window
 * - Answer unexpected failures with an apology instead of failing the request
 * - Reset sessions and expose transcripts
 */
@Slf4j
@Service
public class SimulatorGatewayService {

    private static final int MAX_SESSION_ATTEMPTS = 3;

    private final CorrelationIdService correlationIdService;
    private final SessionService sessionService;
    private final MessageHandlingChain messageHandlingChain;
    private final ButtonSelectionRouter buttonSelectionRouter;
    private final DocumentUploadActions documentUploadActions;
    private final ConversationWindowService conversationWindowService;
    private final ResponseEmitter responseEmitter;
    private final long queueTimeoutMs;

    public SimulatorGatewayService(CorrelationIdService correlationIdService,
                                   SessionService sessionService,
                                   MessageHandlingChain messageHandlingChain,
                                   ButtonSelectionRouter buttonSelectionRouter,
                                   DocumentUploadActions documentUploadActions,
                                   ConversationWindowService conversationWindowService,
                                   ResponseEmitter responseEmitter,
                                   @Value("${simulator.turn.queue-timeout-ms:20000}") long queueTimeoutMs) {
        this.correlationIdService = correlationIdService;
        this.sessionService = sessionService;
        this.messageHandlingChain = messageHandlingChain;
        this.buttonSelectionRouter = buttonSelectionRouter;
        this.documentUploadActions = documentUploadActions;
        this.conversationWindowService = conversationWindowService;
        this.responseEmitter = responseEmitter;
        this.queueTimeoutMs = queueTimeoutMs;
    }

    /**
     * Processes a typed message.
     *
     * @throws MissingPhoneNumberException if the phone header is missing
     * @throws TurnInProgressException if the previous turn did not finish in time
     */
    public SimulatorTurnResponse processMessage(SimulatorMessageRequest request, String phoneHeader) {
        String phoneNumber = extractAndValidatePhoneNumber(phoneHeader);
        return runTurn(phoneNumber, request.getEntityType(), request.getMessageText(), request.getMessageText(),
                messageHandlingChain::handle);
    }

    /**
     * Processes a reply-button or list-menu selection.
     */
    public SimulatorTurnResponse processButton(ButtonRequest request, String phoneHeader) {
        String phoneNumber = extractAndValidatePhoneNumber(phoneHeader);
        String buttonId = request.getButtonId().trim();
        return runTurn(phoneNumber, null, buttonId, buttonId,
                turn -> buttonSelectionRouter.route(turn, buttonId));
    }

    /**
     * Processes a document upload.
     */
    public SimulatorTurnResponse processUpload(UploadRequest request, String phoneHeader) {
        String phoneNumber = extractAndValidatePhoneNumber(phoneHeader);
        DocumentType documentType = request.getDocumentType();
        String label = "📎 " + (request.getFileName() != null && !request.getFileName().isBlank()
                ? request.getFileName()
                : documentType.getWireName());
        return runTurn(phoneNumber, null, label, null,
                turn -> documentUploadActions.processUpload(turn, documentType, request.getImageBase64()));
    }

    /**
     * Replaces the session without waiting for a turn in flight.
     */
    public SimulatorTurnResponse reset(ResetRequest request, String phoneHeader) {
        String phoneNumber = extractAndValidatePhoneNumber(phoneHeader);
        String correlationId = correlationIdService.generateCorrelationId();
        EntityType entityType = request != null ? request.getEntityType() : null;

        SimulatorSession session = sessionService.resetSession(phoneNumber, entityType);
        log.info("Reset request - correlationId: {}, phone: {}, sessionId: {}",
                correlationId, PhoneNumberMasker.mask(phoneNumber), session.getSessionId());

        return SimulatorTurnResponse.builder()
                .correlationId(correlationId)
                .sessionId(session.getSessionId())
                .entityType(session.getEntityType())
                .state(session.getState())
                .messages(List.of())
                .build();
    }

    /**
     * Returns the transcript of the current session, creating an empty session when none exists.
     */
    public TranscriptResponse getTranscript(String phoneHeader) {
        String phoneNumber = extractAndValidatePhoneNumber(phoneHeader);
        SimulatorSession session = sessionService.getOrCreateSession(phoneNumber, null);
        return TranscriptResponse.builder()
                .sessionId(session.getSessionId())
                .entityType(session.getEntityType())
                .state(session.getState())
                .profile(session.getProfile())
                .messages(List.copyOf(session.getTranscript()))
                .build();
    }

    private SimulatorTurnResponse runTurn(String phoneNumber, EntityType entityType, String transcriptText,
                                          String windowText, Consumer<TurnContext> handler) {
        String correlationId = correlationIdService.generateCorrelationId();
        SimulatorSession session = acquireSession(phoneNumber, entityType, correlationId);
        try {
            TurnContext turn = TurnContext.builder()
                    .correlationId(correlationId)
                    .phoneNumber(phoneNumber)
                    .session(session)
                    .messageText(transcriptText)
                    .receivedAt(Instant.now())
                    .build();

            log.info("Turn received - correlationId: {}, phone: {}, sessionId: {}, state: {}",
                    correlationId, PhoneNumberMasker.mask(phoneNumber), session.getSessionId(), session.getState());

            responseEmitter.recordUserMessage(turn, transcriptText);
            try {
                handler.accept(turn);
            } catch (RuntimeException e) {
                log.error("Turn failed - correlationId: {}, sessionId: {}", correlationId, session.getSessionId(), e);
                responseEmitter.text(turn, BotMessageTemplates.TURN_FAILED);
            }

            List<SimulatorMessage> messages = List.copyOf(turn.getOutgoing());
            // A turn that replaced its session leaves the fresh session's window empty
            if (windowText != null && !turn.isStale() && turn.getSession() == session) {
                conversationWindowService.recordTurn(turn.getSession(), windowText, messages);
            }

            log.info("Turn completed - correlationId: {}, sessionId: {}, state: {}, messages: {}, processingMs: {}",
                    correlationId, turn.getSession().getSessionId(), turn.getSession().getState(), messages.size(),
                    Instant.now().toEpochMilli() - turn.getReceivedAt().toEpochMilli());

            return SimulatorTurnResponse.builder()
                    .correlationId(correlationId)
                    .sessionId(turn.getSession().getSessionId())
                    .entityType(turn.getSession().getEntityType())
                    .state(turn.getSession().getState())
                    .messages(messages)
                    .build();
        } finally {
            session.getTurnLock().unlock();
        }
    }

    /**
     * Locks the live session for the phone number. A session replaced while this turn was queued
     * is released and the lookup retried, so the turn never runs against a discarded session.
     */
    private SimulatorSession acquireSession(String phoneNumber, EntityType entityType, String correlationId) {
        for (int attempt = 0; attempt < MAX_SESSION_ATTEMPTS; attempt++) {
            SimulatorSession session = sessionService.getOrCreateSession(phoneNumber, entityType);
            boolean locked;
            try {
                locked = session.getTurnLock().tryLock(queueTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TurnInProgressException("Interrupted while waiting for the previous message");
            }
            if (!locked) {
                log.warn("Turn queue timeout - correlationId: {}, phone: {}, sessionId: {}",
                        correlationId, PhoneNumberMasker.mask(phoneNumber), session.getSessionId());
                throw new TurnInProgressException("Still processing your previous message. Please try again.");
            }
            if (!session.isDiscarded()) {
                return session;
            }
            session.getTurnLock().unlock();
            log.debug("Session replaced while queued, retrying - correlationId: {}", correlationId);
        }
        throw new TurnInProgressException("Session changed while your message was queued. Please try again.");
    }

    /**
     * @throws MissingPhoneNumberException if the header is missing or blank
     */
    private String extractAndValidatePhoneNumber(String phoneHeader) {
        if (phoneHeader == null || phoneHeader.isBlank()) {
            log.error("Missing simulator phone header");
            throw new MissingPhoneNumberException("X-Simulator-Phone header is required");
        }
        return phoneHeader.trim();
    }
}
