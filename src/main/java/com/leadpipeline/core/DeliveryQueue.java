package com.leadpipeline.core;

import com.google.common.base.Preconditions;
import com.leadpipeline.model.FetchCursor;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.QueueEntry;
import com.leadpipeline.model.QueueStats;
import com.leadpipeline.repository.PipelineStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO working set of messages pulled from the store in batches.
 *
 * <p>The queue keeps a cursor on the last fetched {@code (createdAt, id)} and each fetch
 * continues after it, so a row whose status did not change (a dry run, for example) is
 * never pulled in twice. The cursor restarts when the filter changes or on {@link #clear()}.</p>
 */
@Slf4j
public class DeliveryQueue {
    private final PipelineStore store;
    private final int batchSize;

    private final Deque<QueueEntry> entries = new ArrayDeque<>();
    private FetchCursor cursor;

    // Filter used by auto refill; follows the last explicit fetch
    private MessageStatus defaultStatus = MessageStatus.APPROVED;
    private MessageChannel defaultChannel;

    private final AtomicLong totalFetched = new AtomicLong();
    private final AtomicLong totalSent = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong batchCount = new AtomicLong();
    private volatile boolean processing;

    public DeliveryQueue(PipelineStore store, int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        this.store = store;
        this.batchSize = batchSize;
        log.info("DeliveryQueue initialized: batchSize={}", batchSize);
    }

    /**
     * Pull up to one batch of messages in {@code status}, oldest first, onto the tail.
     *
     * @param status  status filter
     * @param channel optional channel filter, null for any
     * @return number of messages fetched; 0 means nothing eligible
     */
    public synchronized int fetchBatch(MessageStatus status, MessageChannel channel) {
        Preconditions.checkNotNull(status, "status");
        if (status != defaultStatus || channel != defaultChannel) {
            cursor = null;
        }
        this.defaultStatus = status;
        this.defaultChannel = channel;

        List<QueueEntry> fetched;
        try {
            fetched = store.fetchEligible(status, channel, batchSize, cursor);
        } catch (RuntimeException e) {
            log.error("Error fetching {} message batch: {}", status, e.getMessage(), e);
            return 0;
        }

        int added = fetched.size();
        entries.addAll(fetched);
        if (!fetched.isEmpty()) {
            cursor = FetchCursor.after(fetched.get(added - 1));
        }

        totalFetched.addAndGet(added);
        long batch = batchCount.incrementAndGet();
        log.info("Fetched batch #{}: {} {} messages (queue size: {})", batch, added, status, entries.size());
        return added;
    }

    /**
     * Pop the head of the queue without waiting
     */
    public synchronized Optional<QueueEntry> getNext() {
        return Optional.ofNullable(entries.pollFirst());
    }

    /**
     * Fetch once with the default filter if fewer than {@code minThreshold} entries are queued
     *
     * @return number of messages fetched, 0 if no refill was needed
     */
    public synchronized int autoRefill(int minThreshold) {
        if (entries.size() < minThreshold) {
            log.debug("Queue below threshold ({} < {}), refilling...", entries.size(), minThreshold);
            return fetchBatch(defaultStatus, defaultChannel);
        }
        return 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Drop queued entries and restart fetching from the oldest row
     */
    public synchronized void clear() {
        entries.clear();
        cursor = null;
        log.warn("Queue cleared");
    }

    void recordSent() {
        totalSent.incrementAndGet();
    }

    void recordFailed() {
        totalFailed.incrementAndGet();
    }

    void setProcessing(boolean processing) {
        this.processing = processing;
    }

    public boolean isProcessing() {
        return processing;
    }

    public QueueStats getStats() {
        return QueueStats.builder()
                .totalFetched(totalFetched.get())
                .totalSent(totalSent.get())
                .totalFailed(totalFailed.get())
                .batchCount(batchCount.get())
                .currentSize(size())
                .processing(processing)
                .build();
    }
}
