package com.prismTax.simulator.project.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of closing a project. A negative excess means the project went over budget.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectCompletion {
    private String projectName;
    private long budget;
    private long spent;
    private long excess;
    private BigDecimal tax;
}
