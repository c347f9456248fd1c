package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Test profile used to skip onboarding when test-data seeding is enabled.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeedProfile {

    private EntityType entityType;

    private CollectedProfile profile;
}
