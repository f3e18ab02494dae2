package com.leadpipeline.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.leadpipeline.model.QueueEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Simulated sender: writes each message to a JSON file instead of delivering it
 */
@Slf4j
public class StorageMessageSender implements MessageSender {
    static final String DRY_RUN_STATUS = "DRY_RUN_SAVED";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path storagePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StorageMessageSender(Path storagePath, ObjectMapper objectMapper, Clock clock) {
        this.storagePath = storagePath;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public boolean send(QueueEntry entry) {
        try {
            Files.createDirectories(storagePath);

            String timestamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
            String filename = String.format("%s_%s_%s_%s_%s.json",
                    timestamp,
                    entry.getChannel().getValue(),
                    safe(entry.getVariant()),
                    safe(entry.getLeadName()),
                    entry.getMessageId());
            Path file = storagePath.resolve(filename);

            objectMapper.writeValue(file.toFile(), toDocument(entry, timestamp));

            log.info("[DRY RUN] Saved {} message to {}", entry.getChannel().getValue(), filename);
            return true;
        } catch (Exception e) {
            log.error("Error saving message {} to storage: {}", entry.getMessageId(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Number of message files currently in storage
     */
    public long storedMessageCount() {
        if (!Files.isDirectory(storagePath)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(storagePath)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json")).count();
        } catch (IOException e) {
            log.warn("Cannot list storage directory {}: {}", storagePath, e.getMessage());
            return 0;
        }
    }

    public Path getStoragePath() {
        return storagePath;
    }

    private Map<String, Object> toDocument(QueueEntry entry, String timestamp) {
        Map<String, Object> lead = new LinkedHashMap<>();
        lead.put("name", entry.getLeadName());
        lead.put("email", entry.getLeadEmail());
        lead.put("company", entry.getCompany());
        lead.put("role", entry.getRole());
        lead.put("linkedin_url", entry.getLinkedinUrl());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("message_id", entry.getMessageId());
        document.put("lead_id", entry.getLeadId());
        document.put("timestamp", timestamp);
        document.put("channel", entry.getChannel().getValue());
        document.put("variant", entry.getVariant());
        document.put("lead", lead);
        document.put("content", entry.getContent());
        document.put("status", DRY_RUN_STATUS);
        return document;
    }

    private static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
