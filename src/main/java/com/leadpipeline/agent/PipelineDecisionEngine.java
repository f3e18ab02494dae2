package com.leadpipeline.agent;

import com.google.common.collect.ImmutableMap;
import com.leadpipeline.config.PipelineProperties;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status-driven state machine that tells an orchestrator what to do next.
 *
 * <p>Message-level rules are evaluated before lead-level rules: a lead in the middle
 * of a message cycle finishes that cycle first. Lookups never throw; statuses the
 * tables do not know come back as an {@link PipelineAction#ERROR} decision.</p>
 */
@Component
@Slf4j
public class PipelineDecisionEngine {

    private static final Map<LeadStatus, Integer> STAGE_PRIORITY = ImmutableMap.<LeadStatus, Integer>builder()
            .put(LeadStatus.NEW, 100)
            .put(LeadStatus.ENRICHED, 80)
            .put(LeadStatus.MESSAGED, 70)
            .put(LeadStatus.APPROVED, 60)
            .put(LeadStatus.FAILED, 50)
            .put(LeadStatus.SENT, 10)
            .build();

    private final PipelineProperties properties;

    public PipelineDecisionEngine(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * Decide from raw status strings, validating them at the boundary
     */
    public PipelineDecision decide(String leadStatus, String messageStatus) {
        MessageStatus message = null;
        if (messageStatus != null && !messageStatus.isBlank()) {
            Optional<MessageStatus> parsed = MessageStatus.parse(messageStatus);
            if (parsed.isEmpty()) {
                log.debug("Unknown message status: {}", messageStatus);
                return PipelineDecision.unknownStatus(messageStatus);
            }
            message = parsed.get();
        }

        Optional<LeadStatus> lead = LeadStatus.parse(leadStatus);
        if (lead.isEmpty()) {
            // Message rules still win over a lead status we cannot read
            if (message != null) {
                PipelineDecision byMessage = decideForMessage(message);
                if (byMessage != null) {
                    return byMessage;
                }
            }
            log.debug("Unknown lead status: {}", leadStatus);
            return PipelineDecision.unknownStatus(leadStatus);
        }
        return decide(lead.get(), message);
    }

    /**
     * Decide the next action for a lead and, optionally, one of its messages
     */
    public PipelineDecision decide(LeadStatus leadStatus, MessageStatus messageStatus) {
        if (messageStatus != null) {
            PipelineDecision byMessage = decideForMessage(messageStatus);
            if (byMessage != null) {
                return byMessage;
            }
        }
        return decideForLead(leadStatus);
    }

    /**
     * Group items by their next action, groups in order of first occurrence
     */
    public Map<PipelineAction, List<RoutedItem>> batchDecide(Collection<PipelineItem> items) {
        Map<PipelineAction, List<RoutedItem>> actions = new LinkedHashMap<>();
        for (PipelineItem item : items) {
            String leadStatus = item.getLeadStatus() != null ? item.getLeadStatus() : LeadStatus.NEW.name();
            PipelineDecision decision = decide(leadStatus, item.getMessageStatus());
            actions.computeIfAbsent(decision.getAction(), k -> new ArrayList<>())
                    .add(new RoutedItem(item, decision));
        }
        return actions;
    }

    /**
     * Whether processing should continue, using the configured retry budget
     */
    public boolean shouldProceed(LeadStatus leadStatus, MessageStatus messageStatus, int retryCount) {
        return shouldProceed(leadStatus, messageStatus, retryCount, properties.getRetry().getMaxRetries());
    }

    public boolean shouldProceed(LeadStatus leadStatus, MessageStatus messageStatus,
                                 int retryCount, int maxRetries) {
        // Delivered
        if (leadStatus == LeadStatus.SENT && messageStatus == MessageStatus.SENT) {
            return false;
        }
        // Retry budget exhausted
        if (messageStatus == MessageStatus.FAILED && retryCount >= maxRetries) {
            return false;
        }
        // Must not be contacted
        return leadStatus == null || !leadStatus.isHardStop();
    }

    /**
     * Ordering score: stage weight plus a tenth of the confidence score
     */
    public int getPriority(LeadStatus leadStatus, int confidenceScore) {
        int stagePriority = leadStatus == null ? 0 : STAGE_PRIORITY.getOrDefault(leadStatus, 0);
        return (int) (stagePriority + confidenceScore / 10.0);
    }

    /**
     * Items sorted by descending priority; ties keep their input order
     */
    public List<PipelineItem> prioritize(Collection<PipelineItem> items) {
        List<PipelineItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt(this::priorityOf).reversed());
        return sorted;
    }

    private int priorityOf(PipelineItem item) {
        LeadStatus status = LeadStatus.parse(item.getLeadStatus()).orElse(null);
        return getPriority(status, item.getConfidenceScore());
    }

    private PipelineDecision decideForMessage(MessageStatus messageStatus) {
        switch (messageStatus) {
            case PENDING:
                return PipelineDecision.of(PipelineAction.REVIEW,
                        ImmutableMap.<String, Object>of("auto_approve", false),
                        "Review pending messages");
            case APPROVED:
                return PipelineDecision.of(PipelineAction.SEND,
                        ImmutableMap.<String, Object>of("use_queue", true,
                                "batch_size", properties.getDelivery().getBatchSize()),
                        "Send approved messages via queue");
            case FAILED:
                return PipelineDecision.of(PipelineAction.RETRY,
                        ImmutableMap.<String, Object>of("max_retries", properties.getRetry().getMaxRetries()),
                        "Retry failed messages");
            case SENT:
                return PipelineDecision.of(PipelineAction.COMPLETE, "Message delivery complete");
            default:
                // No message-level rule, fall through to the lead
                return null;
        }
    }

    private PipelineDecision decideForLead(LeadStatus leadStatus) {
        if (leadStatus == null) {
            return PipelineDecision.unknownStatus(null);
        }
        switch (leadStatus) {
            case NEW:
                return PipelineDecision.of(PipelineAction.GENERATE_LEADS, "Generate new leads");
            case ENRICHED:
                if (properties.getPipeline().getEnrichmentMode() == EnrichmentMode.DEFERRED) {
                    return PipelineDecision.of(PipelineAction.ENRICH,
                            "Enrich lead data with pain points and triggers");
                }
                return PipelineDecision.of(PipelineAction.GENERATE_MESSAGES, "Generate message variants per lead");
            case MESSAGED:
                return PipelineDecision.of(PipelineAction.REVIEW, "Review messages for quality and compliance");
            case APPROVED:
                return PipelineDecision.of(PipelineAction.SEND, "Send approved messages via queue");
            case SENT:
                return PipelineDecision.of(PipelineAction.TRACK_RESPONSES, "Monitor for replies and engagement");
            case FAILED:
                return PipelineDecision.of(PipelineAction.RETRY_OR_ESCALATE, "Retry failed messages or escalate");
            default:
                return PipelineDecision.unknownStatus(leadStatus.name());
        }
    }
}
