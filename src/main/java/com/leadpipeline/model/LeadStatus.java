package com.leadpipeline.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Pipeline stages of a lead.
 *
 * <p>Pipeline stages advance in declaration order (NEW through SENT). FAILED is a
 * side state that may re-enter the pipeline after enrichment; the hard-stop
 * states mean the lead must not be contacted again.</p>
 */
public enum LeadStatus {
    NEW(0),
    ENRICHED(1),
    MESSAGED(2),
    APPROVED(3),
    SENT(4),
    FAILED(-1),
    INVALID(-2),
    BLOCKED(-2),
    UNSUBSCRIBED(-2);

    private static final String LEGACY_GENERATED = "GENERATED";

    private final int stage;

    LeadStatus(int stage) {
        this.stage = stage;
    }

    public boolean isHardStop() {
        return stage == -2;
    }

    /**
     * Whether moving from this status to {@code target} keeps the lead moving forward
     */
    public boolean canMoveTo(LeadStatus target) {
        if (target == this) {
            return true;
        }
        if (isHardStop()) {
            return false;
        }
        if (target == FAILED || target.isHardStop()) {
            return true;
        }
        if (this == FAILED) {
            return target.stage > ENRICHED.stage;
        }
        return target.stage > stage;
    }

    /**
     * Parse a raw status string; the old GENERATED stage is folded into ENRICHED
     */
    public static Optional<LeadStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (LEGACY_GENERATED.equals(normalized)) {
            return Optional.of(ENRICHED);
        }
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
