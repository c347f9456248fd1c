package com.prismTax.simulator.action;

import com.prismTax.simulator.emitter.model.ListMenu;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.session.model.CollectedProfile;
import com.prismTax.simulator.session.model.ReliefEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Relief listing, relief details and relief recording.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReliefActions {

    private final ResponseEmitter responseEmitter;

    /**
     * Lists the relief catalogue and the reliefs already recorded on the profile.
     */
    public void listReliefs(TurnContext turn) {
        CollectedProfile profile = turn.getSession().getProfile();
        StringBuilder text = new StringBuilder("💡 *Available Tax Reliefs (NTA 2025)*\n\n");
        for (ReliefType type : ReliefType.values()) {
            text.append(type.getEmoji()).append(" *").append(type.getTitle()).append("* - ")
                    .append(type.getLimit()).append('\n');
        }

        List<ReliefEntry> applied = profile.getAppliedReliefs();
        if (applied.isEmpty()) {
            text.append("\nYou have not recorded any reliefs yet. Send *add relief <type> <amount>*, e.g. *add relief nhf 120000*.");
        } else {
            text.append("\n*Your reliefs:*\n");
            long total = 0;
            for (ReliefEntry entry : applied) {
                text.append("• ").append(entry.getType()).append(": ").append(format(entry.getAmount())).append('\n');
                total += entry.getAmount();
            }
            text.append("Total claimed: ").append(format(total));
        }

        ListMenu menu = ListMenu.builder()
                .header("💡 Tax Reliefs")
                .buttonText("View reliefs")
                .sections(List.of(ListMenu.Section.builder()
                        .title("Reliefs")
                        .rows(Arrays.stream(ReliefType.values())
                                .map(type -> ListMenu.Row.builder()
                                        .id(type.getButtonId())
                                        .title(type.getTitle())
                                        .description(type.getLimit())
                                        .build())
                                .toList())
                        .build()))
                .build();
        responseEmitter.listMenu(turn, text.toString().trim(), menu);
    }

    /**
     * Details of one relief, picked from the relief menu.
     */
    public void showRelief(TurnContext turn, ReliefType type) {
        responseEmitter.buttons(turn, "💡 *" + type.getTitle() + "*\n\n"
                        + type.getDescription() + "\n\n"
                        + "📊 *Limit:* " + type.getLimit() + "\n"
                        + "📖 *Reference:* " + type.getReference() + "\n\n"
                        + "Record it with *add relief " + type.getKey() + " <amount>*.",
                List.of(ReplyButton.of(TaxCalculationActions.CALC_INCOME_TAX, "🧮 Calculate Tax")));
    }

    /**
     * Records a relief on the profile.
     */
    public void addRelief(TurnContext turn, String reliefName, long amount) {
        ReliefType type = ReliefType.fromText(reliefName);
        if (type == null) {
            responseEmitter.text(turn, "❌ Unknown relief \"" + reliefName + "\".\n\nValid types: "
                    + String.join(", ", Arrays.stream(ReliefType.values()).map(ReliefType::getKey).toList())
                    + "\n\nExample: *add relief nhf 120000*");
            return;
        }
        if (amount <= 0) {
            responseEmitter.text(turn, "❌ The relief amount must be greater than zero.");
            return;
        }

        turn.getSession().getProfile().getAppliedReliefs().add(new ReliefEntry(type.getKey(), amount));
        log.info("Relief recorded - correlationId: {}, sessionId: {}, type: {}, amount: {}",
                turn.getCorrelationId(), turn.getSession().getSessionId(), type.getKey(), amount);
        responseEmitter.text(turn, "✅ " + type.getTitle() + " relief of " + format(amount)
                + " added to your profile.\n\nType *reliefs* to see all your reliefs.");
    }
}
