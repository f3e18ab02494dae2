package com.leadpipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Database entity for one channel/variant of outreach content tied to a lead
 */
@Entity
@Table(name = "messages",
       indexes = {
           @Index(name = "idx_messages_status_channel", columnList = "status,channel"),
           @Index(name = "idx_messages_created_at", columnList = "createdAt"),
           @Index(name = "idx_messages_lead", columnList = "leadId")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutreachMessage {
    /**
     * Unique message identifier
     */
    @Id
    private String id;

    /**
     * Owning lead
     */
    @Column(nullable = false)
    private String leadId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageChannel channel;

    /**
     * A/B tag, free-form
     */
    private String variant;

    /**
     * Rendered content, produced upstream
     */
    @Lob
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageStatus status;

    /**
     * Number of failed delivery attempts
     */
    private int retryCount;

    /**
     * Error message if delivery failed
     */
    @Column(length = 4000)
    private String errorMessage;

    private Instant sentAt;

    @Column(nullable = false)
    private Instant createdAt;

    /**
     * Marks the message as delivered.
     */
    public void markSent(Instant now) {
        this.status = MessageStatus.SENT;
        this.sentAt = now;
        this.errorMessage = null;
    }

    /**
     * Marks a failed delivery attempt; the retry count only grows.
     */
    public void markFailed(String error) {
        this.status = MessageStatus.FAILED;
        this.retryCount++;
        this.errorMessage = error;
    }
}
