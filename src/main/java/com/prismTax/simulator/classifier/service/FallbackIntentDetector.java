package com.prismTax.simulator.classifier.service;

import com.prismTax.simulator.classifier.model.Intent;
import com.prismTax.simulator.classifier.model.IntentName;
import com.prismTax.simulator.classifier.model.IntentSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based intent detection used when the external classifier is disabled or unavailable.
 *
 * Detection strategy:
 * - Rules are evaluated in order, first match wins
 * - Each rule is a set of keyword co-occurrence patterns with a fixed confidence
 * - No match yields no intent, so the message ends in the "not understood" reply
 */
@Slf4j
@Service
public class FallbackIntentDetector {

    private static final Pattern ID_TYPE_PATTERN = Pattern.compile("\\b(nin|bvn|tin|cac)\\b");

    private record Rule(IntentName intent, double confidence, String reasoning, List<Pattern> patterns) {

        boolean matches(String text) {
            return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule(IntentName.GET_TRANSACTION_SUMMARY, 0.7, "Keyword match: transaction/spending query", List.of(
                    Pattern.compile("\\b(show|see|view|list|get)\\b.*\\b(transaction|spending|expense|purchase)"),
                    Pattern.compile("\\b(how much|what did i)\\b.*\\b(spend|buy|paid)"))),
            new Rule(IntentName.GET_TAX_RELIEF_INFO, 0.7, "Keyword match: tax relief query", List.of(
                    Pattern.compile("\\b(rent|mortgage|pension|startup|small business)\\b.*\\b(relief|deduction|exemption)"),
                    Pattern.compile("\\b(how much|what)\\b.*\\b(save|claim|deduct)"))),
            new Rule(IntentName.UPLOAD_RECEIPT, 0.8, "Keyword match: receipt upload", List.of(
                    Pattern.compile("\\b(send|upload|attach|here is|here's)\\b.*\\b(receipt|invoice)"))),
            new Rule(IntentName.CATEGORIZE_EXPENSE, 0.7, "Keyword match: categorization request", List.of(
                    Pattern.compile("\\b(tag|categorize|classify|assign)\\b.*\\b(to|as|under)\\b"),
                    Pattern.compile("\\b(is this|was this)\\b.*\\b(business|personal|project)"))),
            new Rule(IntentName.GET_TAX_CALCULATION, 0.7, "Keyword match: tax calculation", List.of(
                    Pattern.compile("\\b(calculate|compute|how much)\\b.*\\b(tax|vat|cit|pit)"))),
            new Rule(IntentName.VERIFY_IDENTITY, 0.85, "Keyword match: identity verification", List.of(
                    Pattern.compile("\\b(verify|validate|check)\\b.*\\b(nin|bvn|tin|cac)"),
                    Pattern.compile("\\b(nin|bvn|tin|cac)\\b.*\\b(verify|validate|check)"))),
            new Rule(IntentName.CONNECT_BANK, 0.8, "Keyword match: bank connection", List.of(
                    Pattern.compile("\\b(connect|link|add)\\b.*\\b(bank|account)"))),
            new Rule(IntentName.SET_REMINDER, 0.75, "Keyword match: filing reminder", List.of(
                    Pattern.compile("\\b(remind|reminder|deadline)\\b"),
                    Pattern.compile("\\bwhen\\b.*\\b(due|file)\\b")))
    );

    /**
     * Detects an intent from keywords.
     *
     * @param messageText raw user message
     * @return the first matching intent with source FALLBACK, or empty when no rule matches
     */
    public Optional<Intent> detect(String messageText) {
        if (messageText == null || messageText.isBlank()) {
            return Optional.empty();
        }
        String text = messageText.toLowerCase(Locale.ROOT);

        for (Rule rule : RULES) {
            if (rule.matches(text)) {
                log.debug("Fallback intent matched - intent: {}", rule.intent().getWireName());
                return Optional.of(Intent.builder()
                        .name(rule.intent())
                        .confidence(rule.confidence())
                        .entities(entitiesFor(rule.intent(), text))
                        .reasoning(rule.reasoning())
                        .source(IntentSource.FALLBACK)
                        .build());
            }
        }
        return Optional.empty();
    }

    private Map<String, Object> entitiesFor(IntentName intent, String text) {
        Map<String, Object> entities = new HashMap<>();
        if (intent == IntentName.VERIFY_IDENTITY) {
            Matcher matcher = ID_TYPE_PATTERN.matcher(text);
            if (matcher.find()) {
                entities.put("id_type", matcher.group(1).toUpperCase(Locale.ROOT));
            }
        }
        return entities;
    }
}
