package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to the project-funds service. Which fields are set depends on the action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectFundsRequest {

    public static final String ACTION_CREATE = "create";
    public static final String ACTION_EXPENSE = "expense";
    public static final String ACTION_SUMMARY = "summary";
    public static final String ACTION_COMPLETE = "complete";

    @JsonProperty("action")
    private String action;

    @JsonProperty("projectId")
    private String projectId;

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("source")
    private String source;

    @JsonProperty("budget")
    private Long budget;

    @JsonProperty("amount")
    private Long amount;

    @JsonProperty("description")
    private String description;
}
