package com.leadpipeline.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Outreach delivery channels
 */
public enum MessageChannel {
    EMAIL("email"),
    LINKEDIN("linkedin");

    private final String value;

    MessageChannel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<MessageChannel> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MessageChannel channel : values()) {
            if (channel.value.equals(normalized)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
