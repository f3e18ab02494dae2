package com.leadpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of record counts plus the most recent delivery queue
 */
@Value
@Builder
public class PipelineStats {
    Map<LeadStatus, Long> leadsByStatus;
    Map<MessageStatus, Long> messagesByStatus;

    /**
     * Null until the first dispatch run
     */
    QueueStats lastQueue;
}
