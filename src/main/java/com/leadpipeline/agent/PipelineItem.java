package com.leadpipeline.agent;

import lombok.Builder;
import lombok.Value;

/**
 * A lead or message as seen by an orchestrator; statuses are raw strings from outside the core
 */
@Value
@Builder
public class PipelineItem {
    String leadId;
    String messageId;
    String leadStatus;
    String messageStatus;
    @Builder.Default
    int confidenceScore = 50;
    int retryCount;
}
