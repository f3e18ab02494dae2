package com.leadpipeline.repository;

import com.leadpipeline.model.FetchCursor;
import com.leadpipeline.model.Lead;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import com.leadpipeline.model.QueueEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.leadpipeline.repository.MessageSpecifications.afterCursor;
import static com.leadpipeline.repository.MessageSpecifications.hasStatus;
import static com.leadpipeline.repository.MessageSpecifications.onChannel;
import static com.leadpipeline.repository.MessageSpecifications.withExistingLead;

/**
 * {@link PipelineStore} backed by the Spring Data repositories
 */
@Component
@Slf4j
public class JpaPipelineStore implements PipelineStore {
    private final MessageRepository messageRepository;
    private final LeadRepository leadRepository;

    public JpaPipelineStore(MessageRepository messageRepository, LeadRepository leadRepository) {
        this.messageRepository = messageRepository;
        this.leadRepository = leadRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueueEntry> fetchEligible(MessageStatus status, MessageChannel channel, int limit,
                                          FetchCursor after) {
        List<OutreachMessage> messages = messageRepository.findAll(
                hasStatus(status).and(onChannel(channel)).and(withExistingLead()).and(afterCursor(after)),
                PageRequest.of(0, limit, Sort.by(Sort.Direction.ASC, "createdAt", "id"))
        ).getContent();

        if (messages.isEmpty()) {
            return List.of();
        }

        // Join in the lead fields needed for dispatch
        Set<String> leadIds = messages.stream()
                .map(OutreachMessage::getLeadId)
                .collect(Collectors.toSet());
        Map<String, Lead> leads = leadRepository.findAllById(leadIds).stream()
                .collect(Collectors.toMap(Lead::getId, Function.identity()));

        List<QueueEntry> entries = new ArrayList<>(messages.size());
        for (OutreachMessage message : messages) {
            Lead lead = leads.get(message.getLeadId());
            if (lead == null) {
                log.warn("Message {} references missing lead {}, skipping", message.getId(), message.getLeadId());
                continue;
            }
            entries.add(toEntry(message, lead));
        }
        return entries;
    }

    @Override
    @Transactional
    public boolean updateMessageStatus(String messageId, MessageStatus status, String error) {
        Optional<OutreachMessage> found = messageRepository.findById(messageId);
        if (found.isEmpty()) {
            log.warn("Cannot update status of unknown message {}", messageId);
            return false;
        }

        OutreachMessage message = found.get();
        if (message.getStatus().isTerminal()) {
            log.warn("Refusing to move message {} from terminal status {} to {}",
                    messageId, message.getStatus(), status);
            return false;
        }
        if (status == MessageStatus.SENT) {
            message.markSent(Instant.now());
        } else if (status == MessageStatus.FAILED) {
            message.markFailed(error);
        } else {
            message.setStatus(status);
        }
        messageRepository.save(message);
        return true;
    }

    @Override
    @Transactional
    public boolean updateLeadStatus(String leadId, LeadStatus status) {
        Optional<Lead> found = leadRepository.findById(leadId);
        if (found.isEmpty()) {
            log.warn("Cannot update status of unknown lead {}", leadId);
            return false;
        }

        Lead lead = found.get();
        if (!lead.getStatus().canMoveTo(status)) {
            log.warn("Refusing to move lead {} from {} to {}", leadId, lead.getStatus(), status);
            return false;
        }
        lead.setStatus(status);
        lead.setUpdatedAt(Instant.now());
        leadRepository.save(lead);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OutreachMessage> findPendingMessages(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return messageRepository.findByStatusOrderByCreatedAtAsc(MessageStatus.PENDING);
        }
        return messageRepository.findByStatusAndIdInOrderByCreatedAtAsc(MessageStatus.PENDING, ids);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<LeadStatus, Long> countLeadsByStatus() {
        Map<LeadStatus, Long> counts = new EnumMap<>(LeadStatus.class);
        for (LeadStatus status : LeadStatus.values()) {
            counts.put(status, leadRepository.countByStatus(status));
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<MessageStatus, Long> countMessagesByStatus() {
        Map<MessageStatus, Long> counts = new EnumMap<>(MessageStatus.class);
        for (MessageStatus status : MessageStatus.values()) {
            counts.put(status, messageRepository.countByStatus(status));
        }
        return counts;
    }

    private QueueEntry toEntry(OutreachMessage message, Lead lead) {
        return QueueEntry.builder()
                .messageId(message.getId())
                .leadId(message.getLeadId())
                .channel(message.getChannel())
                .variant(message.getVariant())
                .content(message.getContent())
                .messageStatus(message.getStatus())
                .retryCount(message.getRetryCount())
                .createdAt(message.getCreatedAt())
                .leadName(lead.getFullName())
                .leadEmail(lead.getEmail())
                .company(lead.getCompanyName())
                .role(lead.getRole())
                .linkedinUrl(lead.getLinkedinUrl())
                .leadStatus(lead.getStatus())
                .build();
    }
}
