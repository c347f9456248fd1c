package com.prismTax.simulator.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates correlation IDs that tie a turn's log lines and collaborator calls together.
 */
@Service
public class CorrelationIdService {

    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
