package com.prismTax.simulator.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A relief the simulated user has declared, e.g. NHF contributions of 120,000.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReliefEntry {
    private String type;
    private long amount;
}
