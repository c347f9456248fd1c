package com.prismTax.simulator.session.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.CollectedProfile;
import com.prismTax.simulator.session.model.EmploymentStatus;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Onboarding state machine.
 *
 * Individuals: NEW, AWAITING_NIN, AWAITING_FULL_NAME, AWAITING_EMPLOYMENT_STATUS, REGISTERED.
 * Businesses: NEW, AWAITING_TIN, AWAITING_BUSINESS_NAME, REGISTERED.
 *
 * Invalid input re-prompts and leaves the state unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationFlowService {

    private static final Set<String> GREETINGS = Set.of("hi", "hello", "hey", "start", "help", "get started");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private final ResponseEmitter responseEmitter;
    private final SeedProfileCatalog seedProfileCatalog;
    private final SimulatorPolicyProperties policy;

    @Value("${simulator.seed-test-data:false}")
    private boolean seedTestData;

    /**
     * True for the states this service owns.
     */
    public boolean handles(SessionState state) {
        return switch (state) {
            case NEW, AWAITING_NIN, AWAITING_FULL_NAME, AWAITING_EMPLOYMENT_STATUS,
                    AWAITING_TIN, AWAITING_BUSINESS_NAME -> true;
            case REGISTERED, AWAITING_INVOICE_UPLOAD, AWAITING_INVOICE_CONFIRMATION -> false;
        };
    }

    /**
     * Consumes a free-text message in one of the onboarding states.
     */
    public void handleMessage(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        SessionState state = session.getState();
        log.debug("Registration step - correlationId: {}, sessionId: {}, state: {}",
                turn.getCorrelationId(), session.getSessionId(), state);

        switch (state) {
            case NEW -> handleNew(turn);
            case AWAITING_NIN -> handleNin(turn);
            case AWAITING_FULL_NAME -> handleFullName(turn);
            case AWAITING_EMPLOYMENT_STATUS -> handleEmploymentText(turn);
            case AWAITING_TIN -> handleTin(turn);
            case AWAITING_BUSINESS_NAME -> handleBusinessName(turn);
            default -> throw new IllegalStateException("Not an onboarding state: " + state);
        }
    }

    /**
     * Applies an employment-status button. Outside AWAITING_EMPLOYMENT_STATUS the option is stale.
     */
    public void selectEmploymentStatus(TurnContext turn, EmploymentStatus status) {
        if (turn.getSession().getState() != SessionState.AWAITING_EMPLOYMENT_STATUS) {
            responseEmitter.text(turn, BotMessageTemplates.OPTION_UNAVAILABLE);
            return;
        }
        completeIndividual(turn, status);
    }

    private void handleNew(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (!GREETINGS.contains(turn.normalizedText())) {
            responseEmitter.text(turn, BotMessageTemplates.NEW_USER_NUDGE);
            return;
        }

        if (seedTestData) {
            Optional<CollectedProfile> seeded = seedProfileCatalog.profileFor(session.getEntityType());
            if (seeded.isPresent()) {
                session.setProfile(seeded.get());
                session.setState(SessionState.REGISTERED);
                log.info("Seeded test profile - correlationId: {}, sessionId: {}, entityType: {}",
                        turn.getCorrelationId(), session.getSessionId(), session.getEntityType());
                responseEmitter.text(turn, "🧪 Test profile loaded for *" + seeded.get().displayName() + "*.\n\n"
                        + BotMessageTemplates.HELP_MESSAGE);
                return;
            }
        }

        if (session.getEntityType() == EntityType.INDIVIDUAL) {
            session.setState(SessionState.AWAITING_NIN);
            responseEmitter.text(turn, BotMessageTemplates.ASK_NIN);
        } else {
            session.setState(SessionState.AWAITING_TIN);
            responseEmitter.text(turn, BotMessageTemplates.ASK_TIN);
        }
    }

    private void handleNin(TurnContext turn) {
        String digits = digitsOf(turn.getMessageText());
        if (digits.length() != policy.getNinLength()) {
            responseEmitter.text(turn, String.format(BotMessageTemplates.INVALID_NIN, policy.getNinLength()));
            return;
        }
        SimulatorSession session = turn.getSession();
        session.getProfile().setNin(digits);
        session.setState(SessionState.AWAITING_FULL_NAME);
        responseEmitter.text(turn, String.format(BotMessageTemplates.ASK_FULL_NAME, digits));
    }

    private void handleFullName(TurnContext turn) {
        String name = cleaned(turn.getMessageText());
        if (name.isEmpty() || !HAS_LETTER.matcher(name).find()) {
            responseEmitter.text(turn, BotMessageTemplates.INVALID_FULL_NAME);
            return;
        }
        SimulatorSession session = turn.getSession();
        session.getProfile().setFullName(name);
        session.setState(SessionState.AWAITING_EMPLOYMENT_STATUS);
        responseEmitter.buttons(turn, String.format(BotMessageTemplates.ASK_EMPLOYMENT_STATUS, firstName(name)),
                employmentButtons());
    }

    private void handleEmploymentText(TurnContext turn) {
        EmploymentStatus status = EmploymentStatus.fromText(turn.getMessageText());
        if (status == null) {
            responseEmitter.buttons(turn, BotMessageTemplates.INVALID_EMPLOYMENT_STATUS, employmentButtons());
            return;
        }
        completeIndividual(turn, status);
    }

    private void completeIndividual(TurnContext turn, EmploymentStatus status) {
        SimulatorSession session = turn.getSession();
        session.getProfile().setEmploymentStatus(status);
        session.setState(SessionState.REGISTERED);
        log.info("Individual registered - correlationId: {}, sessionId: {}, employmentStatus: {}",
                turn.getCorrelationId(), session.getSessionId(), status);
        responseEmitter.text(turn, "🎉 Registration complete! Welcome, *" + session.getProfile().getFullName()
                + "* (" + status.getLabel() + ").\n\n" + BotMessageTemplates.HELP_MESSAGE);
    }

    private void handleTin(TurnContext turn) {
        String digits = digitsOf(turn.getMessageText());
        if (digits.length() < policy.getTinMinLength()) {
            responseEmitter.text(turn, String.format(BotMessageTemplates.INVALID_TIN, policy.getTinMinLength()));
            return;
        }
        SimulatorSession session = turn.getSession();
        session.getProfile().setTin(digits);
        session.setState(SessionState.AWAITING_BUSINESS_NAME);
        responseEmitter.text(turn, String.format(BotMessageTemplates.ASK_BUSINESS_NAME, digits));
    }

    private void handleBusinessName(TurnContext turn) {
        String name = cleaned(turn.getMessageText());
        if (name.length() < 2) {
            responseEmitter.text(turn, BotMessageTemplates.INVALID_BUSINESS_NAME);
            return;
        }
        SimulatorSession session = turn.getSession();
        session.getProfile().setBusinessName(name);
        session.setState(SessionState.REGISTERED);
        log.info("Business registered - correlationId: {}, sessionId: {}", turn.getCorrelationId(), session.getSessionId());
        responseEmitter.text(turn, "🎉 Registration complete! *" + name + "* is now set up on PRISM.\n\n"
                + BotMessageTemplates.HELP_MESSAGE);
    }

    private List<ReplyButton> employmentButtons() {
        return Arrays.stream(EmploymentStatus.values())
                .map(status -> ReplyButton.of(status.getButtonId(), status.getLabel()))
                .toList();
    }

    private static String digitsOf(String text) {
        return text == null ? "" : text.replaceAll("\\D", "");
    }

    private static String cleaned(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }

    private static String firstName(String fullName) {
        int space = fullName.indexOf(' ');
        return space > 0 ? fullName.substring(0, space) : fullName;
    }
}
