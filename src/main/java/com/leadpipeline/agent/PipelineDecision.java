package com.leadpipeline.agent;

import com.google.common.collect.ImmutableMap;
import lombok.Value;

/**
 * Result of a state machine lookup
 */
@Value
public class PipelineDecision {
    public static final String PARAM_STATUS = "status";

    PipelineAction action;
    ImmutableMap<String, Object> parameters;
    String description;

    public static PipelineDecision of(PipelineAction action, String description) {
        return new PipelineDecision(action, ImmutableMap.of(), description);
    }

    public static PipelineDecision of(PipelineAction action, ImmutableMap<String, Object> parameters,
                                      String description) {
        return new PipelineDecision(action, parameters, description);
    }

    /**
     * A non-fatal decision for a status neither lookup table knows
     */
    public static PipelineDecision unknownStatus(String status) {
        return new PipelineDecision(PipelineAction.ERROR,
                ImmutableMap.<String, Object>of(PARAM_STATUS, String.valueOf(status)),
                "Unknown status: " + status);
    }

    public String getTargetOperation() {
        return action.getTargetOperation();
    }

    public boolean isError() {
        return action == PipelineAction.ERROR;
    }
}
