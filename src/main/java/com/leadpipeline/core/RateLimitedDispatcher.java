package com.leadpipeline.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.leadpipeline.agent.PipelineDecisionEngine;
import com.leadpipeline.config.PipelineProperties;
import com.leadpipeline.model.DispatchResult;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.QueueEntry;
import com.leadpipeline.repository.PipelineStore;
import com.leadpipeline.sender.MessageSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains a {@link DeliveryQueue} at a fixed cadence of {@code 60 / maxPerMinute} seconds.
 *
 * <p>The full delay is waited after every dispatched item regardless of how long the
 * send took, so throughput never exceeds the configured rate. A failure of one item is
 * written back as a FAILED message and never stops the loop.</p>
 */
@Component
@Slf4j
public class RateLimitedDispatcher {
    static final String DELIVERY_FAILED = "Delivery failed";
    private static final int MAX_ERROR_LENGTH = 2000;

    private final PipelineStore store;
    private final PipelineDecisionEngine decisionEngine;
    private final PipelineProperties properties;
    private final DispatchPacer pacer;

    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public RateLimitedDispatcher(PipelineStore store, PipelineDecisionEngine decisionEngine,
                                 PipelineProperties properties, DispatchPacer pacer) {
        this.store = store;
        this.decisionEngine = decisionEngine;
        this.properties = properties;
        this.pacer = pacer;
    }

    /**
     * Process the queue until it is empty and no refill yields anything, a stop is
     * requested, or the thread is interrupted.
     *
     * @param queue  queue to drain
     * @param sender sender to dispatch through
     * @param dryRun if true, successful dispatches leave message and lead status unchanged
     */
    public DispatchResult process(DeliveryQueue queue, MessageSender sender, boolean dryRun) {
        PipelineProperties.Delivery delivery = properties.getDelivery();
        Preconditions.checkArgument(delivery.getMaxPerMinute() > 0,
                "maxPerMinute must be positive: %s", delivery.getMaxPerMinute());
        Duration delay = Duration.ofNanos(TimeUnit.MINUTES.toNanos(1) / delivery.getMaxPerMinute());

        queue.setProcessing(true);

        int sent = 0;
        int failed = 0;
        int skipped = 0;
        Set<String> advancedLeads = new HashSet<>();
        Stopwatch stopwatch = Stopwatch.createStarted(pacer.ticker());

        log.info("Starting message processing (rate: {}/min, delay: {} ms, dryRun: {})",
                delivery.getMaxPerMinute(), delay.toMillis(), dryRun);

        try {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                queue.autoRefill(delivery.getRefillThreshold());

                Optional<QueueEntry> next = queue.getNext();
                if (next.isEmpty()) {
                    break;
                }
                QueueEntry entry = next.get();

                if (!decisionEngine.shouldProceed(entry.getLeadStatus(), entry.getMessageStatus(),
                        entry.getRetryCount())) {
                    log.info("Skipping message {} (lead {} is {}, message {} after {} retries)",
                            entry.getMessageId(), entry.getLeadId(), entry.getLeadStatus(),
                            entry.getMessageStatus(), entry.getRetryCount());
                    skipped++;
                    continue;
                }

                if (dispatch(entry, sender, dryRun, advancedLeads)) {
                    sent++;
                    queue.recordSent();
                } else {
                    failed++;
                    queue.recordFailed();
                }

                try {
                    pacer.pause(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Message processing interrupted, {} messages left in queue", queue.size());
                    break;
                }
            }
        } finally {
            queue.setProcessing(false);
            stopRequested.set(false);
        }

        Duration elapsed = stopwatch.elapsed();
        double elapsedSeconds = elapsed.toNanos() / 1_000_000_000.0;
        double achievedRate = elapsedSeconds > 0 ? sent / elapsedSeconds * 60 : 0;

        log.info("Processing complete: {} sent, {} failed, {} skipped in {} s ({} per minute)",
                sent, failed, skipped, String.format("%.1f", elapsedSeconds), String.format("%.2f", achievedRate));

        return DispatchResult.builder()
                .sent(sent)
                .failed(failed)
                .skipped(skipped)
                .elapsed(elapsed)
                .achievedRatePerMinute(achievedRate)
                .dryRun(dryRun)
                .build();
    }

    /**
     * Ask the current {@link #process} call to return after its current item. A request made
     * just before a run starts is honoured by that run; the flag clears when the run ends.
     */
    public void requestStop() {
        log.info("Stop requested for message processing");
        stopRequested.set(true);
    }

    private boolean dispatch(QueueEntry entry, MessageSender sender, boolean dryRun, Set<String> advancedLeads) {
        try {
            boolean success = sender.send(entry);

            if (!success) {
                store.updateMessageStatus(entry.getMessageId(), MessageStatus.FAILED, DELIVERY_FAILED);
                log.warn("Message {} to {} failed (attempt {})", entry.getMessageId(),
                        entry.getLeadName(), entry.getRetryCount() + 1);
                return false;
            }

            if (dryRun) {
                log.info("[DRY RUN] Dispatched {} message {} to {}, status left at {}",
                        entry.getChannel().getValue(), entry.getMessageId(), entry.getLeadName(),
                        entry.getMessageStatus());
                return true;
            }

            store.updateMessageStatus(entry.getMessageId(), MessageStatus.SENT, null);
        } catch (RuntimeException e) {
            log.error("Error processing message {}: {}", entry.getMessageId(), e.getMessage(), e);
            markFailed(entry, safeError(e));
            return false;
        }

        // Only the lead's first delivery moves it to SENT
        if (entry.getLeadStatus() != LeadStatus.SENT && advancedLeads.add(entry.getLeadId())) {
            advanceLead(entry);
        }
        return true;
    }

    private void advanceLead(QueueEntry entry) {
        try {
            store.updateLeadStatus(entry.getLeadId(), LeadStatus.SENT);
        } catch (RuntimeException e) {
            log.error("Message {} delivered but lead {} could not be marked SENT: {}",
                    entry.getMessageId(), entry.getLeadId(), e.getMessage(), e);
        }
    }

    private void markFailed(QueueEntry entry, String error) {
        try {
            store.updateMessageStatus(entry.getMessageId(), MessageStatus.FAILED, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of message {}: {}", entry.getMessageId(), e.getMessage(), e);
        }
    }

    private String safeError(Exception ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        if (msg.length() > MAX_ERROR_LENGTH) {
            msg = msg.substring(0, MAX_ERROR_LENGTH);
        }
        return msg;
    }
}
