package com.prismTax.simulator.session.service;

import com.prismTax.simulator.session.model.CollectedProfile;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.ReliefEntry;
import com.prismTax.simulator.session.model.SeedProfile;
import com.prismTax.simulator.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Seeded test profiles, one per entity type, loaded once from the classpath.
 */
@Slf4j
@Component
public class SeedProfileCatalog {

    private final Map<EntityType, CollectedProfile> profiles = new EnumMap<>(EntityType.class);

    public SeedProfileCatalog(@Value("${simulator.seed-profiles-path:data/seed-profiles.json}") String resourcePath) {
        for (SeedProfile seed : JsonFileLoader.loadAsListOrEmpty(resourcePath, SeedProfile.class)) {
            if (seed.getEntityType() != null && seed.getProfile() != null) {
                profiles.putIfAbsent(seed.getEntityType(), seed.getProfile());
            }
        }
        log.info("Loaded seed profiles - path: {}, entityTypes: {}", resourcePath, profiles.keySet());
    }

    /**
     * @return a fresh copy of the seeded profile, so sessions never share relief lists
     */
    public Optional<CollectedProfile> profileFor(EntityType entityType) {
        CollectedProfile seed = profiles.get(entityType);
        if (seed == null) {
            return Optional.empty();
        }
        List<ReliefEntry> reliefs = new ArrayList<>();
        if (seed.getAppliedReliefs() != null) {
            seed.getAppliedReliefs().forEach(r -> reliefs.add(new ReliefEntry(r.getType(), r.getAmount())));
        }
        return Optional.of(CollectedProfile.builder()
                .nin(seed.getNin())
                .fullName(seed.getFullName())
                .employmentStatus(seed.getEmploymentStatus())
                .tin(seed.getTin())
                .businessName(seed.getBusinessName())
                .appliedReliefs(reliefs)
                .build());
    }
}
