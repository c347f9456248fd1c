package com.prismTax.simulator.emitter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Intent attached to a message so the admin can see why the bot answered the way it did.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntentTrace {
    private String name;
    private double confidence;
    private String source;
}
