package com.prismTax.simulator.classifier.model;

import com.prismTax.simulator.grammar.AmountParser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured guess of what the user wants.
 *
 * Confidence and entities come from the classifier as-is and are never recomputed here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Intent {

    private IntentName name;

    /**
     * Confidence in [0, 1].
     */
    private double confidence;

    @Builder.Default
    private Map<String, Object> entities = new HashMap<>();

    private String reasoning;

    private IntentSource source;

    /**
     * @return the entity as trimmed text, or null when absent or blank
     */
    public String entityText(String key) {
        Object value = entities == null ? null : entities.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Reads an amount entity. Numbers are floored; strings go through the grammar's amount rules.
     *
     * @return the amount, or null when absent or unparseable
     */
    public Long entityAmount(String key) {
        Object value = entities == null ? null : entities.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            return AmountParser.parse(text);
        }
        return null;
    }
}
