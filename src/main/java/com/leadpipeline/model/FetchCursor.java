package com.leadpipeline.model;

import lombok.Value;

import java.time.Instant;

/**
 * Position after the last fetched message in {@code (createdAt, id)} order
 */
@Value
public class FetchCursor {
    Instant createdAt;
    String messageId;

    public static FetchCursor after(QueueEntry entry) {
        return new FetchCursor(entry.getCreatedAt(), entry.getMessageId());
    }
}
