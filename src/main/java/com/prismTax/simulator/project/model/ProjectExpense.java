package com.prismTax.simulator.project.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectExpense {
    private long amount;
    private String description;

    /**
     * Advisory texts raised by the risk heuristic when the expense was recorded.
     */
    private List<String> advisories;

    private Instant recordedAt;
}
