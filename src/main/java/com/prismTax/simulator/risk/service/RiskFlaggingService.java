package com.prismTax.simulator.risk.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.risk.model.RiskFlag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Risk flagging heuristic for expenses and statement debits.
 *
 * Rules, evaluated independently (flags are additive):
 * - cash / labour keyword AND amount at or above the large-cash threshold: LARGE_CASH_EXPENSE
 * - vagueness keyword, any amount: VAGUE_DESCRIPTION
 *
 * A keyword matches anywhere in the lower-cased description, so "handworkers" and "miscellaneous" match.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskFlaggingService {

    private static final List<String> CASH_KEYWORDS = List.of("labor", "labour", "cash", "worker");
    private static final List<String> VAGUE_KEYWORDS = List.of("misc", "sundry", "various", "other", "general");

    private final SimulatorPolicyProperties policy;

    /**
     * @param description free-text description; null is treated as empty
     * @param amount amount in whole Naira
     * @return raised flags in rule order, empty when nothing applies
     */
    public List<RiskFlag> assess(String description, long amount) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        List<RiskFlag> flags = new ArrayList<>();

        if (containsAny(text, CASH_KEYWORDS) && amount >= policy.getLargeCashExpenseThreshold()) {
            flags.add(RiskFlag.LARGE_CASH_EXPENSE);
        }
        if (containsAny(text, VAGUE_KEYWORDS)) {
            flags.add(RiskFlag.VAGUE_DESCRIPTION);
        }

        if (!flags.isEmpty()) {
            log.debug("Risk flags raised - amount: {}, flags: {}", amount, flags);
        }
        return flags;
    }

    /**
     * Same as {@link #assess(String, long)}, returning the advisory texts.
     */
    public List<String> advisories(String description, long amount) {
        return assess(description, amount).stream()
                .map(RiskFlag::getAdvisory)
                .toList();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
