package com.prismTax.simulator.project.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Project fund currently open in a session (e.g. money received from a relative to build a house).
 * {@code spent} only ever grows; balance is derived.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveProject {

    /**
     * Identifier assigned by the project-funds service.
     */
    private String projectId;

    private String name;

    /**
     * Who provided the funds.
     */
    private String source;

    private long budget;

    private long spent;

    @Builder.Default
    private List<ProjectExpense> expenses = new ArrayList<>();

    private Instant createdAt;

    public long getBalance() {
        return budget - spent;
    }
}
