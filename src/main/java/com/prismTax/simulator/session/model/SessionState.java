package com.prismTax.simulator.session.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Position of a simulated conversation in the onboarding / command flow.
 */
public enum SessionState {
    NEW,
    AWAITING_NIN,
    AWAITING_FULL_NAME,
    AWAITING_EMPLOYMENT_STATUS,
    AWAITING_TIN,
    AWAITING_BUSINESS_NAME,
    REGISTERED,
    AWAITING_INVOICE_UPLOAD,
    AWAITING_INVOICE_CONFIRMATION;

    private static final Set<SessionState> COMMAND_ZONE =
            EnumSet.of(REGISTERED, AWAITING_INVOICE_UPLOAD, AWAITING_INVOICE_CONFIRMATION);

    /**
     * States in which the command grammar and intent classifier may run.
     */
    public boolean isCommandZone() {
        return COMMAND_ZONE.contains(this);
    }

    /**
     * States that accept a document upload.
     */
    public boolean acceptsUpload() {
        return this == REGISTERED || this == AWAITING_INVOICE_UPLOAD;
    }
}
