package com.leadpipeline.core;

import com.leadpipeline.agent.PipelineDecision;
import com.leadpipeline.agent.PipelineDecisionEngine;
import com.leadpipeline.config.PipelineProperties;
import com.leadpipeline.model.DispatchResult;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.PipelineStats;
import com.leadpipeline.model.ReviewResult;
import com.leadpipeline.repository.PipelineStore;
import com.leadpipeline.sender.MessageSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point an orchestrator drives the pipeline through.
 *
 * <p>Each send run gets its own {@link DeliveryQueue}; only one run may be active at a time.</p>
 */
@Service
@Slf4j
public class OutreachPipelineService {
    private final PipelineDecisionEngine decisionEngine;
    private final MessageReviewService reviewService;
    private final RateLimitedDispatcher dispatcher;
    private final PipelineStore store;
    private final PipelineProperties properties;
    private final MessageSender simulatedSender;
    private final MessageSender liveSender;

    private final ReentrantLock dispatchLock = new ReentrantLock();
    private volatile DeliveryQueue lastQueue;

    public OutreachPipelineService(
            PipelineDecisionEngine decisionEngine,
            MessageReviewService reviewService,
            RateLimitedDispatcher dispatcher,
            PipelineStore store,
            PipelineProperties properties,
            @Qualifier("simulatedMessageSender") MessageSender simulatedSender,
            @Qualifier("liveMessageSender") MessageSender liveSender) {
        this.decisionEngine = decisionEngine;
        this.reviewService = reviewService;
        this.dispatcher = dispatcher;
        this.store = store;
        this.properties = properties;
        this.simulatedSender = simulatedSender;
        this.liveSender = liveSender;
    }

    public PipelineDecision decide(String leadStatus, String messageStatus) {
        return decisionEngine.decide(leadStatus, messageStatus);
    }

    public ReviewResult review(Collection<String> messageIds) {
        return reviewService.review(messageIds);
    }

    public DispatchResult sendApproved(boolean dryRun) {
        return sendApproved(dryRun, null);
    }

    /**
     * Deliver approved messages, oldest first, at the configured rate
     *
     * @param channel optional channel filter, null for any
     */
    public DispatchResult sendApproved(boolean dryRun, MessageChannel channel) {
        return runDispatch(MessageStatus.APPROVED, channel, dryRun);
    }

    /**
     * Re-dispatch failed messages that still have retry budget left
     */
    public DispatchResult retryFailed(boolean dryRun) {
        return runDispatch(MessageStatus.FAILED, null, dryRun);
    }

    /**
     * Ask the active dispatch run, if any, to stop after its current message
     */
    public void stopDispatch() {
        if (!isDispatching()) {
            log.info("No dispatch run in progress, nothing to stop");
            return;
        }
        dispatcher.requestStop();
    }

    public boolean isDispatching() {
        return dispatchLock.isLocked();
    }

    public PipelineStats stats() {
        DeliveryQueue queue = lastQueue;
        return PipelineStats.builder()
                .leadsByStatus(store.countLeadsByStatus())
                .messagesByStatus(store.countMessagesByStatus())
                .lastQueue(queue != null ? queue.getStats() : null)
                .build();
    }

    private DispatchResult runDispatch(MessageStatus status, MessageChannel channel, boolean dryRun) {
        if (!dispatchLock.tryLock()) {
            throw new IllegalStateException("A dispatch run is already in progress");
        }
        try {
            log.info("Dispatching {} messages (channel={}, dryRun={})", status,
                    channel != null ? channel.getValue() : "any", dryRun);

            DeliveryQueue queue = new DeliveryQueue(store, properties.getDelivery().getBatchSize());
            lastQueue = queue;
            queue.fetchBatch(status, channel);

            return dispatcher.process(queue, dryRun ? simulatedSender : liveSender, dryRun);
        } finally {
            dispatchLock.unlock();
        }
    }
}
