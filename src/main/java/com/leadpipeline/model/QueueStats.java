package com.leadpipeline.model;

import lombok.Builder;
import lombok.Value;

/**
 * Cumulative statistics of one delivery queue instance
 */
@Value
@Builder
public class QueueStats {
    long totalFetched;
    long totalSent;
    long totalFailed;
    long batchCount;
    int currentSize;
    boolean processing;
}
