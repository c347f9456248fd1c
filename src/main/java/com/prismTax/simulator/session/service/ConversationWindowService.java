package com.prismTax.simulator.session.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.session.model.ConversationTurn;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maintains the sliding window of recent turns sent to the classifier as context.
 *
 * Handles:
 * - Appending the user text and the bot replies of a finished turn
 * - Skipping "processing..." placeholders and blank texts
 * - Evicting the oldest entries beyond the configured window size
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationWindowService {

    private final SimulatorPolicyProperties policy;

    public void recordTurn(SimulatorSession session, String userText, List<SimulatorMessage> botMessages) {
        append(session, ConversationTurn.ROLE_USER, userText);
        for (SimulatorMessage message : botMessages) {
            if (!message.isPlaceholder()) {
                append(session, ConversationTurn.ROLE_ASSISTANT, message.getText());
            }
        }
    }

    private void append(SimulatorSession session, String role, String content) {
        if (content == null || content.isBlank()) {
            return;
        }
        List<ConversationTurn> window = session.getConversationWindow();
        window.add(new ConversationTurn(role, content));

        // Keep only the last N turns
        while (window.size() > policy.getConversationWindowSize()) {
            window.remove(0);
        }
        log.debug("Conversation window updated - sessionId: {}, size: {}", session.getSessionId(), window.size());
    }
}
