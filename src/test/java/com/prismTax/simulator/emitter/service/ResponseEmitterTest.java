package com.prismTax.simulator.emitter.service;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.emitter.model.MessageSender;
import com.prismTax.simulator.emitter.model.RenderKind;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.SimulatorSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseEmitter")
class ResponseEmitterTest {

    private final ResponseEmitter emitter = new ResponseEmitter();

    @Test
    @DisplayName("messages are appended to transcript and turn in call order")
    void appendsInOrder() {
        SimulatorSession session = TurnFixtures.registeredBusiness();
        TurnContext turn = TurnFixtures.turn(session, "summary");

        emitter.recordUserMessage(turn, "summary");
        emitter.processing(turn, "working...");
        emitter.buttons(turn, "Pick one", List.of(ReplyButton.of("pay_now", "Pay")));

        assertThat(session.getTranscript())
                .extracting(SimulatorMessage::getSender)
                .containsExactly(MessageSender.USER, MessageSender.BOT, MessageSender.BOT);
        assertThat(turn.getOutgoing())
                .extracting(SimulatorMessage::getRenderKind)
                .containsExactly(RenderKind.PLAIN, RenderKind.BUTTON_CHOICE);
        assertThat(turn.getOutgoing().get(0).isPlaceholder()).isTrue();
    }

    @Test
    @DisplayName("results for a discarded session are dropped")
    void dropsStaleResults() {
        SimulatorSession session = TurnFixtures.registeredBusiness();
        TurnContext turn = TurnFixtures.turn(session, "vat 50000");
        emitter.processing(turn, "🧮 Calculating VAT...");

        session.setDiscarded(true);
        SimulatorMessage late = emitter.text(turn, "📊 *VAT Calculation*");

        assertThat(late).isNull();
        assertThat(session.getTranscript()).hasSize(1);
        assertThat(turn.getOutgoing()).hasSize(1);
    }
}
