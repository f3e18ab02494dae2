package com.leadpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one run of the rate-limited dispatch loop
 */
@Value
@Builder
public class DispatchResult {
    int sent;
    int failed;

    /**
     * Entries popped but not dispatched (hard-stop lead or exhausted retries)
     */
    int skipped;

    Duration elapsed;
    double achievedRatePerMinute;
    boolean dryRun;
}
