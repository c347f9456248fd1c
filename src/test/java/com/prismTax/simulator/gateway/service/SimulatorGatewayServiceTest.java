package com.prismTax.simulator.gateway.service;

import com.prismTax.simulator.TurnFixtures;
import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.MessageSender;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.controller.GlobalExceptionHandler;
import com.prismTax.simulator.gateway.dto.SimulatorMessageRequest;
import com.prismTax.simulator.gateway.dto.SimulatorTurnResponse;
import com.prismTax.simulator.gateway.dto.TranscriptResponse;
import com.prismTax.simulator.gateway.exception.TurnInProgressException;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.routing.ButtonSelectionRouter;
import com.prismTax.simulator.routing.MessageHandlingChain;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.session.service.ConversationWindowService;
import com.prismTax.simulator.session.service.SessionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimulatorGatewayService")
class SimulatorGatewayServiceTest {

    private static final String PHONE = TurnFixtures.PHONE;

    @Mock
    private MessageHandlingChain messageHandlingChain;
    @Mock
    private ButtonSelectionRouter buttonSelectionRouter;
    @Mock
    private DocumentUploadActions documentUploadActions;

    private final SessionService sessionService = new SessionService(30, 100);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final CountDownLatch handlerEntered = new CountDownLatch(1);
    private final CountDownLatch releaseHandler = new CountDownLatch(1);

    private SimulatorGatewayService gatewayService;

    @BeforeEach
    void setUp() {
        ResponseEmitter responseEmitter = new ResponseEmitter();
        gatewayService = new SimulatorGatewayService(new CorrelationIdService(), sessionService, messageHandlingChain,
                buttonSelectionRouter, documentUploadActions,
                new ConversationWindowService(new SimulatorPolicyProperties()), responseEmitter, 100);
    }

    @AfterEach
    void tearDown() {
        releaseHandler.countDown();
        executor.shutdownNow();
    }

    /**
     * Chain that parks until released, then moves its session forward and replies.
     */
    private void blockingChain() {
        ResponseEmitter responseEmitter = new ResponseEmitter();
        doAnswer(invocation -> {
            TurnContext turn = invocation.getArgument(0);
            handlerEntered.countDown();
            releaseHandler.await(5, TimeUnit.SECONDS);
            turn.getSession().setState(SessionState.REGISTERED);
            responseEmitter.text(turn, "late reply");
            return null;
        }).when(messageHandlingChain).handle(any(TurnContext.class));
    }

    private Future<SimulatorTurnResponse> startFirstTurn() throws InterruptedException {
        Future<SimulatorTurnResponse> first = executor.submit(() ->
                gatewayService.processMessage(new SimulatorMessageRequest("hi", EntityType.INDIVIDUAL), PHONE));
        assertThat(handlerEntered.await(5, TimeUnit.SECONDS)).isTrue();
        return first;
    }

    @Test
    @DisplayName("a second turn that cannot get the session lock in time is rejected with 409")
    void queuedTurnTimesOut() throws Exception {
        blockingChain();
        Future<SimulatorTurnResponse> first = startFirstTurn();

        assertThatThrownBy(() -> gatewayService.processMessage(new SimulatorMessageRequest("vat 1000", null), PHONE))
                .isInstanceOf(TurnInProgressException.class)
                .satisfies(e -> assertThat(new GlobalExceptionHandler()
                        .handleTurnInProgress((TurnInProgressException) e).getStatusCode())
                        .isEqualTo(HttpStatus.CONFLICT));

        releaseHandler.countDown();
        SimulatorTurnResponse response = first.get(5, TimeUnit.SECONDS);
        assertThat(response.getState()).isEqualTo(SessionState.REGISTERED);
        assertThat(response.getMessages()).extracting(SimulatorMessage::getText).containsExactly("late reply");
        verify(messageHandlingChain).handle(any(TurnContext.class));
    }

    @Test
    @DisplayName("a reset during a running turn drops that turn's output and leaves the fresh session untouched")
    void resetDuringTurnDropsLateOutput() throws Exception {
        blockingChain();
        Future<SimulatorTurnResponse> first = startFirstTurn();
        SimulatorSession original = sessionService.getSession(PHONE);

        SimulatorTurnResponse resetResponse = gatewayService.reset(null, PHONE);
        releaseHandler.countDown();
        SimulatorTurnResponse late = first.get(5, TimeUnit.SECONDS);

        assertThat(late.getMessages()).isEmpty();
        assertThat(original.isDiscarded()).isTrue();

        SimulatorSession live = sessionService.getSession(PHONE);
        assertThat(live.getSessionId()).isEqualTo(resetResponse.getSessionId()).isNotEqualTo(original.getSessionId());
        assertThat(live.getEntityType()).isEqualTo(EntityType.INDIVIDUAL);
        assertThat(live.getState()).isEqualTo(SessionState.NEW);
        assertThat(live.getTranscript()).isEmpty();
        assertThat(live.getConversationWindow()).isEmpty();
        assertThat(live.getTurnLock().isLocked()).isFalse();
    }

    @Test
    @DisplayName("transcript reads stay consistent while a turn appends to the transcript")
    void transcriptReadDuringWrites() throws Exception {
        SimulatorSession session = sessionService.getOrCreateSession(PHONE, EntityType.BUSINESS);
        int writes = 2_000;
        Future<?> writer = executor.submit(() -> {
            for (int i = 0; i < writes; i++) {
                session.getTranscript().add(SimulatorMessage.builder()
                        .id("m-" + i)
                        .sender(MessageSender.BOT)
                        .text("line " + i)
                        .timestamp(Instant.now())
                        .build());
            }
        });

        int previousSize = 0;
        while (!writer.isDone()) {
            TranscriptResponse transcript = gatewayService.getTranscript(PHONE);
            List<SimulatorMessage> messages = transcript.getMessages();
            assertThat(messages).doesNotContainNull().hasSizeGreaterThanOrEqualTo(previousSize);
            previousSize = messages.size();
        }
        writer.get(5, TimeUnit.SECONDS);

        assertThat(gatewayService.getTranscript(PHONE).getMessages()).hasSize(writes);
    }
}
