package com.leadpipeline.core;

import com.google.common.collect.Maps;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import com.leadpipeline.model.ReviewResult;
import com.leadpipeline.repository.PipelineStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Approves exactly one variant per (lead, channel) among pending messages and rejects its siblings
 */
@Service
@Slf4j
public class MessageReviewService {
    private final PipelineStore store;
    private final Random random;

    public MessageReviewService(PipelineStore store, Random random) {
        this.store = store;
        this.random = random;
    }

    /**
     * Review pending messages.
     *
     * @param messageIds restrict the review to these ids, or null/empty for every pending message
     */
    public ReviewResult review(Collection<String> messageIds) {
        List<OutreachMessage> pending = store.findPendingMessages(messageIds);

        // Group by (lead, channel) for variant selection
        Map<Map.Entry<String, MessageChannel>, List<OutreachMessage>> grouped = new LinkedHashMap<>();
        for (OutreachMessage message : pending) {
            grouped.computeIfAbsent(Maps.immutableEntry(message.getLeadId(), message.getChannel()),
                    k -> new ArrayList<>()).add(message);
        }

        int approved = 0;
        int rejected = 0;
        Set<String> approvedLeads = new LinkedHashSet<>();

        for (Map.Entry<Map.Entry<String, MessageChannel>, List<OutreachMessage>> group : grouped.entrySet()) {
            List<OutreachMessage> variants = group.getValue();
            OutreachMessage selected = variants.get(random.nextInt(variants.size()));

            for (OutreachMessage message : variants) {
                if (message == selected) {
                    store.updateMessageStatus(message.getId(), MessageStatus.APPROVED, null);
                    approved++;
                    log.info("Approved variant {} for {} (lead {})", message.getVariant(),
                            message.getChannel().getValue(), message.getLeadId());
                } else {
                    store.updateMessageStatus(message.getId(), MessageStatus.REJECTED, null);
                    rejected++;
                    log.debug("Rejected variant {} for {} (lead {})", message.getVariant(),
                            message.getChannel().getValue(), message.getLeadId());
                }
            }
            approvedLeads.add(group.getKey().getKey());
        }

        for (String leadId : approvedLeads) {
            store.updateLeadStatus(leadId, LeadStatus.APPROVED);
        }

        log.info("Reviewed {} messages: {} approved, {} rejected", pending.size(), approved, rejected);
        return ReviewResult.builder()
                .reviewed(pending.size())
                .approved(approved)
                .rejected(rejected)
                .build();
    }
}
