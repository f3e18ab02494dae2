package com.leadpipeline.agent;

import lombok.Value;

/**
 * An item paired with the decision made for it
 */
@Value
public class RoutedItem {
    PipelineItem item;
    PipelineDecision decision;
}
