package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One (role, text) entry of the classifier context window.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;
    private String content;
}
