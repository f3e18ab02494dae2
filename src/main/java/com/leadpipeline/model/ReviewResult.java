package com.leadpipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReviewResult {
    int reviewed;
    int approved;
    int rejected;
}
