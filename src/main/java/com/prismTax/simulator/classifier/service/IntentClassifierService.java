package com.prismTax.simulator.classifier.service;

import com.prismTax.simulator.classifier.dto.NluClassifyRequest;
import com.prismTax.simulator.classifier.dto.NluClassifyResponse;
import com.prismTax.simulator.classifier.exception.InvalidClassifierContextException;
import com.prismTax.simulator.classifier.model.ClassificationResult;
import com.prismTax.simulator.classifier.model.Intent;
import com.prismTax.simulator.classifier.model.IntentName;
import com.prismTax.simulator.classifier.model.IntentSource;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.session.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Intent classifier adapter.
 *
 * Responsibilities:
 * - Validate the message and context window before any call is made
 * - Call the external classifier when enabled
 * - Fall back to keyword rules when the classifier is disabled, fails, or returns nothing usable
 * - Never recompute confidence or entities returned by the classifier
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClassifierService {

    private final NluApiClient nluApiClient;
    private final FallbackIntentDetector fallbackIntentDetector;
    private final SimulatorPolicyProperties policy;

    @Value("${simulator.classifier.enabled:true}")
    private boolean classifierEnabled;

    @Value("${simulator.classifier.fallback-enabled:true}")
    private boolean fallbackEnabled;

    /**
     * True when a classification will call the remote classifier.
     */
    public boolean isRemoteEnabled() {
        return classifierEnabled;
    }

    /**
     * Classifies a message.
     *
     * @param message user message
     * @param context recent turns, oldest first
     * @param correlationId correlation ID for logging
     * @return the classification, or empty when neither the classifier nor the fallback produced an intent
     * @throws InvalidClassifierContextException when the message or context is malformed
     */
    public Optional<ClassificationResult> classify(String message, List<ConversationTurn> context, String correlationId) {
        validate(message, context);

        if (classifierEnabled) {
            try {
                Optional<ClassificationResult> remote = callClassifier(message, context, correlationId);
                if (remote.isPresent()) {
                    return remote;
                }
                log.warn("Classifier returned no usable intent - correlationId: {}", correlationId);
            } catch (CollaboratorCallException e) {
                log.warn("Classifier unavailable, trying fallback - correlationId: {}, error: {}",
                        correlationId, e.getMessage());
            }
        }

        if (!fallbackEnabled) {
            return Optional.empty();
        }

        Optional<ClassificationResult> fallback = fallbackIntentDetector.detect(message)
                .map(intent -> ClassificationResult.builder().intent(intent).build());
        log.info("Fallback classification - correlationId: {}, intent: {}", correlationId,
                fallback.map(result -> result.getIntent().getName().getWireName()).orElse("none"));
        return fallback;
    }

    private Optional<ClassificationResult> callClassifier(String message, List<ConversationTurn> context,
                                                         String correlationId) {
        NluClassifyRequest request = NluClassifyRequest.builder()
                .message(message)
                .context(context == null ? List.of() : List.copyOf(context))
                .build();

        NluClassifyResponse response = nluApiClient.classify(request, correlationId);
        if (response.getIntent() == null) {
            return Optional.empty();
        }

        IntentName name = IntentName.fromWireName(response.getIntent().getName());
        if (name == null) {
            log.warn("Unknown intent name from classifier - correlationId: {}, name: {}",
                    correlationId, response.getIntent().getName());
            return Optional.empty();
        }

        Double confidence = response.getIntent().getConfidence();
        Intent intent = Intent.builder()
                .name(name)
                .confidence(confidence == null ? 0.0 : confidence)
                .entities(response.getIntent().getEntities() == null
                        ? new HashMap<>() : response.getIntent().getEntities())
                .reasoning(response.getIntent().getReasoning())
                .source(IntentSource.CLASSIFIER)
                .build();

        log.info("Classifier result - correlationId: {}, intent: {}, confidence: {}",
                correlationId, name.getWireName(), intent.getConfidence());

        return Optional.of(ClassificationResult.builder()
                .intent(intent)
                .artificialTransactionCheck(response.getArtificialTransactionCheck())
                .build());
    }

    private void validate(String message, List<ConversationTurn> context) {
        if (message == null || message.isBlank()) {
            throw new InvalidClassifierContextException("message must not be blank");
        }
        if (context == null) {
            return;
        }
        if (context.size() > policy.getConversationWindowSize()) {
            throw new InvalidClassifierContextException(
                    "context must hold at most " + policy.getConversationWindowSize() + " entries, got " + context.size());
        }
        for (int i = 0; i < context.size(); i++) {
            ConversationTurn turn = context.get(i);
            if (turn == null) {
                throw new InvalidClassifierContextException("context[" + i + "] must not be null");
            }
            if (!ConversationTurn.ROLE_USER.equals(turn.getRole())
                    && !ConversationTurn.ROLE_ASSISTANT.equals(turn.getRole())) {
                throw new InvalidClassifierContextException(
                        "context[" + i + "].role must be 'user' or 'assistant', got '" + turn.getRole() + "'");
            }
            if (turn.getContent() == null || turn.getContent().isBlank()) {
                throw new InvalidClassifierContextException("context[" + i + "].content must not be blank");
            }
        }
    }
}
