package com.leadpipeline.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Possible states for an outreach message in the delivery pipeline
 */
public enum MessageStatus {
    /**
     * Generated, waiting for review
     */
    PENDING,

    /**
     * Selected by review, eligible for delivery
     */
    APPROVED,

    /**
     * Sibling variant not selected by review
     */
    REJECTED,

    /**
     * Successfully delivered
     */
    SENT,

    /**
     * Delivery failed; retried until the retry budget runs out
     */
    FAILED;

    /**
     * SENT and REJECTED never move again
     */
    public boolean isTerminal() {
        return this == SENT || this == REJECTED;
    }

    /**
     * Parse a raw status string coming from outside the core
     */
    public static Optional<MessageStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
