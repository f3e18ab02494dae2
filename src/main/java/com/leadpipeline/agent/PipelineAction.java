package com.leadpipeline.agent;

/**
 * Next step an orchestrator should take for a lead or message
 */
public enum PipelineAction {
    GENERATE_LEADS("generate_leads", "generate_leads"),
    ENRICH("enrich", "enrich_leads"),
    GENERATE_MESSAGES("generate_messages", "generate_messages"),
    REVIEW("review", "review_messages"),
    SEND("send", "send_messages"),
    RETRY("retry", "retry_failed"),
    RETRY_OR_ESCALATE("retry_or_escalate", "retry_failed"),
    TRACK_RESPONSES("track_responses", "track_responses"),
    COMPLETE("complete", null),
    ERROR("error", null);

    private final String actionName;
    private final String targetOperation;

    PipelineAction(String actionName, String targetOperation) {
        this.actionName = actionName;
        this.targetOperation = targetOperation;
    }

    public String getActionName() {
        return actionName;
    }

    /**
     * Operation the orchestrator should invoke, null when there is nothing to call
     */
    public String getTargetOperation() {
        return targetOperation;
    }
}
