package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration data collected incrementally during onboarding.
 * Fields are only ever filled in; a full session reset is the only way to clear them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CollectedProfile {

    /**
     * National Identification Number (individuals).
     */
    private String nin;

    private String fullName;

    private EmploymentStatus employmentStatus;

    /**
     * Tax Identification Number (businesses).
     */
    private String tin;

    private String businessName;

    @Builder.Default
    private List<ReliefEntry> appliedReliefs = new ArrayList<>();

    /**
     * Display name used in bot replies: business name, full name, or a generic fallback.
     */
    public String displayName() {
        if (businessName != null && !businessName.isBlank()) {
            return businessName;
        }
        if (fullName != null && !fullName.isBlank()) {
            return fullName;
        }
        return "Your Business";
    }
}
