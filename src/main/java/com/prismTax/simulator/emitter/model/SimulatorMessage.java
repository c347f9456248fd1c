package com.prismTax.simulator.emitter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the simulated chat transcript.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulatorMessage {

    private String id;

    private MessageSender sender;

    private String text;

    @Builder.Default
    private RenderKind renderKind = RenderKind.PLAIN;

    /**
     * Reply buttons, present only for BUTTON_CHOICE.
     */
    private List<ReplyButton> buttons;

    /**
     * List menu, present only for LIST_MENU.
     */
    private ListMenu listMenu;

    private IntentTrace intent;

    /**
     * True for the "processing..." message shown while a remote call is in flight.
     */
    private boolean placeholder;

    private Instant timestamp;
}
