package com.prismTax.simulator.grammar;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Command grammar matcher.
 *
 * Responsibilities:
 * - Normalize the message (trim, collapse whitespace)
 * - Try each {@link GrammarCommand} in declaration order, first full match wins
 * - Parse captured amounts; a command whose amount does not parse is skipped
 */
@Slf4j
@Service
public class CommandGrammarMatcher {

    /**
     * @param messageText raw user message
     * @return the first matching command, or empty when the message is not a command
     */
    public Optional<CommandMatch> match(String messageText) {
        if (messageText == null || messageText.isBlank()) {
            return Optional.empty();
        }
        String text = messageText.trim().replaceAll("\\s+", " ");

        for (GrammarCommand command : GrammarCommand.values()) {
            Matcher matcher = command.getPattern().matcher(text);
            if (!matcher.matches()) {
                continue;
            }
            Optional<CommandMatch> match = toMatch(command, matcher);
            if (match.isPresent()) {
                log.debug("Grammar command matched - command: {}", command);
                return match;
            }
        }
        return Optional.empty();
    }

    private Optional<CommandMatch> toMatch(GrammarCommand command, Matcher matcher) {
        String rawAmount = group(matcher, "amount");
        String rawSecondAmount = group(matcher, "secondAmount");
        Long amount = AmountParser.parse(rawAmount);
        Long secondAmount = AmountParser.parse(rawSecondAmount);
        if ((rawAmount != null && amount == null) || (rawSecondAmount != null && secondAmount == null)) {
            return Optional.empty();
        }

        return Optional.of(CommandMatch.builder()
                .command(command)
                .amount(amount)
                .secondAmount(secondAmount)
                .name(trimmed(group(matcher, "name")))
                .source(trimmed(group(matcher, "source")))
                .description(trimmed(group(matcher, "description")))
                .reliefType(trimmed(group(matcher, "reliefType")))
                .document(trimmed(group(matcher, "document")))
                .build());
    }

    private static String group(Matcher matcher, String name) {
        if (!matcher.pattern().pattern().contains("(?<" + name + ">")) {
            return null;
        }
        return matcher.group(name);
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }
}
