package com.leadpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * In-memory projection of a message plus the lead fields needed to dispatch it
 */
@Value
@Builder
public class QueueEntry {
    String messageId;
    String leadId;
    MessageChannel channel;
    String variant;
    String content;
    MessageStatus messageStatus;
    int retryCount;
    Instant createdAt;

    String leadName;
    String leadEmail;
    String company;
    String role;
    String linkedinUrl;
    LeadStatus leadStatus;
}
