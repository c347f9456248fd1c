package com.prismTax.simulator.grammar;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A matched command with its captured arguments. Fields a command does not capture stay null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommandMatch {

    private GrammarCommand command;

    private Long amount;

    /**
     * Business income in a mixed command, expenses in a freelance command.
     */
    private Long secondAmount;

    /**
     * Project name, original casing kept.
     */
    private String name;

    private String source;

    private String description;

    private String reliefType;

    /**
     * Document named in an upload command ("invoice", "receipt", "statement").
     */
    private String document;
}
