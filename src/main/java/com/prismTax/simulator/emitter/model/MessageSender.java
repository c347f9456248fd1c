package com.prismTax.simulator.emitter.model;

public enum MessageSender {
    USER,
    BOT
}
