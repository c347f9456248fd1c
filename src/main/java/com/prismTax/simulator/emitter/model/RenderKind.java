package com.prismTax.simulator.emitter.model;

/**
 * How the chat surface should draw a message: plain text, reply buttons, or a list menu.
 */
public enum RenderKind {
    PLAIN,
    BUTTON_CHOICE,
    LIST_MENU
}
