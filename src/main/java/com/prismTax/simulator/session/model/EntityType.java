package com.prismTax.simulator.session.model;

public enum EntityType {
    BUSINESS,
    INDIVIDUAL
}
