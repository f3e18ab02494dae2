package com.leadpipeline.repository;

import com.leadpipeline.model.FetchCursor;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import com.leadpipeline.model.QueueEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistence port the pipeline core reads and mutates records through
 */
public interface PipelineStore {

    /**
     * Fetch up to {@code limit} messages in {@code status}, ordered by creation time then id,
     * joined with their lead. Messages whose lead no longer exists are dropped.
     *
     * @param status  status filter
     * @param channel optional channel filter, null for any
     * @param limit   maximum rows
     * @param after   only rows strictly after this position, null to start from the oldest
     */
    List<QueueEntry> fetchEligible(MessageStatus status, MessageChannel channel, int limit,
                                   FetchCursor after);

    /**
     * Update a message status. SENT stamps {@code sentAt}; FAILED increments the
     * retry count and records {@code error}.
     *
     * @return false if the message does not exist or is already SENT or REJECTED
     */
    boolean updateMessageStatus(String messageId, MessageStatus status, String error);

    /**
     * Move a lead to {@code status}.
     *
     * @return false if the lead does not exist or the move would regress it
     */
    boolean updateLeadStatus(String leadId, LeadStatus status);

    /**
     * PENDING messages, optionally restricted to {@code ids}, oldest first
     */
    List<OutreachMessage> findPendingMessages(Collection<String> ids);

    Map<LeadStatus, Long> countLeadsByStatus();

    Map<MessageStatus, Long> countMessagesByStatus();
}
