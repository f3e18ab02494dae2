package com.leadpipeline.test;

import com.leadpipeline.agent.PipelineDecisionEngine;
import com.leadpipeline.config.PipelineProperties;
import com.leadpipeline.core.DeliveryQueue;
import com.leadpipeline.core.MessageReviewService;
import com.leadpipeline.core.RateLimitedDispatcher;
import com.leadpipeline.model.DispatchResult;
import com.leadpipeline.model.LeadStatus;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import com.leadpipeline.model.QueueEntry;
import com.leadpipeline.sender.MessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RateLimitedDispatcherTest {

    private InMemoryPipelineStore store;
    private VirtualDispatchPacer pacer;
    private PipelineProperties properties;
    private RateLimitedDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryPipelineStore();
        pacer = new VirtualDispatchPacer();
        properties = new PipelineProperties();
        properties.getDelivery().setMaxPerMinute(10);
        dispatcher = new RateLimitedDispatcher(store, new PipelineDecisionEngine(properties), properties, pacer);
    }

    @Test
    void testDispatchNeverExceedsConfiguredRate() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        for (int i = 1; i <= 5; i++) {
            store.addMessage("m" + i, "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        }
        MessageSender sender = entry -> {
            // Sending itself takes a moment
            pacer.advance(Duration.ofMillis(200));
            return true;
        };

        DispatchResult result = dispatcher.process(approvedQueue(), sender, false);

        assertEquals(5, result.getSent());
        assertEquals(0, result.getFailed());
        assertTrue(result.getElapsed().compareTo(Duration.ofSeconds(24)) >= 0,
                "elapsed " + result.getElapsed());
        assertTrue(result.getAchievedRatePerMinute() <= 10.0 + 1e-9,
                "rate " + result.getAchievedRatePerMinute());
        assertEquals(5, pacer.getPauses().size());
        assertEquals(Duration.ofSeconds(6), pacer.getPauses().get(0));
    }

    @Test
    void testSuccessfulLiveSendMarksMessageAndLeadSent() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);

        DispatchResult result = dispatcher.process(approvedQueue(), entry -> true, false);

        assertEquals(1, result.getSent());
        OutreachMessage message = store.message("m1");
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertNotNull(message.getSentAt());
        assertEquals(0, message.getRetryCount());
        assertEquals(LeadStatus.SENT, store.lead("lead-1").getStatus());
    }

    @Test
    void testLeadAdvancedOnlyOnFirstDelivery() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        store.addMessage("m2", "lead-1", MessageChannel.LINKEDIN, "A", MessageStatus.APPROVED);

        DispatchResult result = dispatcher.process(approvedQueue(), entry -> true, false);

        assertEquals(2, result.getSent());
        assertEquals(1, store.getLeadUpdates());
        assertEquals(LeadStatus.SENT, store.lead("lead-1").getStatus());
    }

    @Test
    void testLeadWriteErrorDoesNotUndoDelivery() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        InMemoryPipelineStore failingLeads = spy(store);
        doThrow(new IllegalStateException("db down")).when(failingLeads).updateLeadStatus(any(), any());
        RateLimitedDispatcher guarded = new RateLimitedDispatcher(failingLeads,
                new PipelineDecisionEngine(properties), properties, pacer);
        DeliveryQueue queue = new DeliveryQueue(failingLeads, 10);
        queue.fetchBatch(MessageStatus.APPROVED, null);

        DispatchResult result = guarded.process(queue, entry -> true, false);

        assertEquals(1, result.getSent());
        assertEquals(0, result.getFailed());
        OutreachMessage message = failingLeads.message("m1");
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals(0, message.getRetryCount());
        assertNull(message.getErrorMessage());

        DeliveryQueue retryQueue = new DeliveryQueue(failingLeads, 10);
        assertEquals(0, retryQueue.fetchBatch(MessageStatus.FAILED, null));
    }

    @Test
    void testFailedSendIncrementsRetryCount() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        MessageSender failing = entry -> false;

        DispatchResult first = dispatcher.process(approvedQueue(), failing, false);
        DispatchResult second = dispatcher.process(failedQueue(), failing, false);

        assertEquals(1, first.getFailed());
        assertEquals(1, second.getFailed());
        OutreachMessage message = store.message("m1");
        assertEquals(MessageStatus.FAILED, message.getStatus());
        assertEquals(2, message.getRetryCount());
        assertEquals("Delivery failed", message.getErrorMessage());
        assertEquals(LeadStatus.APPROVED, store.lead("lead-1").getStatus());
    }

    @Test
    void testExhaustedRetriesAreSkipped() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        OutreachMessage exhausted = store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.FAILED);
        exhausted.setRetryCount(2);
        store.addMessage("m2", "lead-1", MessageChannel.EMAIL, "B", MessageStatus.FAILED);
        MessageSender sender = mock(MessageSender.class);
        when(sender.send(any())).thenReturn(true);

        DispatchResult result = dispatcher.process(failedQueue(), sender, false);

        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getSent());
        verify(sender, times(1)).send(any());
        assertEquals(MessageStatus.FAILED, store.message("m1").getStatus());
        assertEquals(MessageStatus.SENT, store.message("m2").getStatus());
        // Skipped entries are not paced
        assertEquals(1, pacer.getPauses().size());
    }

    @Test
    void testHardStopLeadsAreNeverSent() {
        store.addLead("blocked", LeadStatus.BLOCKED);
        store.addLead("gone", LeadStatus.UNSUBSCRIBED);
        store.addMessage("m1", "blocked", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        store.addMessage("m2", "gone", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        MessageSender sender = mock(MessageSender.class);

        DispatchResult result = dispatcher.process(approvedQueue(), sender, false);

        assertEquals(2, result.getSkipped());
        verifyNoInteractions(sender);
        assertEquals(MessageStatus.APPROVED, store.message("m1").getStatus());
        assertEquals(LeadStatus.BLOCKED, store.lead("blocked").getStatus());
    }

    @Test
    void testExceptionInOneItemDoesNotStopTheLoop() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        store.addMessage("m2", "lead-1", MessageChannel.EMAIL, "B", MessageStatus.APPROVED);
        MessageSender sender = mock(MessageSender.class);
        when(sender.send(argThat(entry -> entry != null && "m1".equals(entry.getMessageId()))))
                .thenThrow(new IllegalStateException("connection reset"));
        when(sender.send(argThat(entry -> entry != null && "m2".equals(entry.getMessageId()))))
                .thenReturn(true);

        DispatchResult result = dispatcher.process(approvedQueue(), sender, false);

        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSent());
        OutreachMessage broken = store.message("m1");
        assertEquals(MessageStatus.FAILED, broken.getStatus());
        assertEquals(1, broken.getRetryCount());
        assertEquals("connection reset", broken.getErrorMessage());
        assertEquals(MessageStatus.SENT, store.message("m2").getStatus());
        assertEquals(2, pacer.getPauses().size());
    }

    @Test
    void testLongErrorIsTruncated() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        String longError = "x".repeat(5000);
        MessageSender sender = entry -> {
            throw new IllegalStateException(longError);
        };

        dispatcher.process(approvedQueue(), sender, false);

        assertEquals(2000, store.message("m1").getErrorMessage().length());
    }

    @Test
    void testDryRunLeavesStatusUnchanged() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        List<String> dispatched = new ArrayList<>();

        DispatchResult result = dispatcher.process(approvedQueue(), entry -> dispatched.add(entry.getMessageId()), true);

        assertTrue(result.isDryRun());
        assertEquals(1, result.getSent());
        assertEquals(List.of("m1"), dispatched);
        assertEquals(MessageStatus.APPROVED, store.message("m1").getStatus());
        assertNull(store.message("m1").getSentAt());
        assertEquals(LeadStatus.APPROVED, store.lead("lead-1").getStatus());
    }

    @Test
    void testDryRunFailureIsStillRecorded() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);

        dispatcher.process(approvedQueue(), entry -> false, true);

        assertEquals(MessageStatus.FAILED, store.message("m1").getStatus());
        assertEquals(1, store.message("m1").getRetryCount());
    }

    @Test
    void testRefillDrainsMoreThanOneBatch() {
        properties.getDelivery().setRefillThreshold(1);
        store.addLead("lead-1", LeadStatus.APPROVED);
        for (int i = 1; i <= 5; i++) {
            store.addMessage("m" + i, "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        }
        DeliveryQueue queue = new DeliveryQueue(store, 2);
        queue.fetchBatch(MessageStatus.APPROVED, null);

        DispatchResult result = dispatcher.process(queue, entry -> true, false);

        assertEquals(5, result.getSent());
        assertEquals(5, queue.getStats().getTotalSent());
        assertTrue(queue.getStats().getBatchCount() >= 3);
        assertFalse(queue.isProcessing());
    }

    @Test
    void testDryRunTerminatesWithoutRefetchingSameRows() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        store.addMessage("m2", "lead-1", MessageChannel.EMAIL, "B", MessageStatus.APPROVED);
        MessageSender sender = mock(MessageSender.class);
        when(sender.send(any())).thenReturn(true);

        DispatchResult result = dispatcher.process(approvedQueue(), sender, true);

        assertEquals(2, result.getSent());
        verify(sender, times(2)).send(any());
    }

    @Test
    void testStopRequestEndsRunAfterCurrentItem() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        for (int i = 1; i <= 3; i++) {
            store.addMessage("m" + i, "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        }
        MessageSender sender = entry -> {
            dispatcher.requestStop();
            return true;
        };

        DispatchResult result = dispatcher.process(approvedQueue(), sender, false);

        assertEquals(1, result.getSent());
        assertEquals(MessageStatus.APPROVED, store.message("m2").getStatus());
        assertEquals(MessageStatus.APPROVED, store.message("m3").getStatus());
    }

    @Test
    void testStopRequestedBeforeRunStartsIsHonoured() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        DeliveryQueue queue = approvedQueue();

        dispatcher.requestStop();
        DispatchResult stopped = dispatcher.process(queue, entry -> true, false);

        assertEquals(0, stopped.getSent());
        assertEquals(MessageStatus.APPROVED, store.message("m1").getStatus());

        // The flag is cleared once the run ends
        DispatchResult next = dispatcher.process(queue, entry -> true, false);
        assertEquals(1, next.getSent());
    }

    @Test
    void testInterruptEndsRun() {
        store.addLead("lead-1", LeadStatus.APPROVED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.APPROVED);
        store.addMessage("m2", "lead-1", MessageChannel.EMAIL, "B", MessageStatus.APPROVED);
        RateLimitedDispatcher interrupted = new RateLimitedDispatcher(store,
                new PipelineDecisionEngine(properties), properties, new VirtualDispatchPacer() {
                    @Override
                    public void pause(Duration delay) {
                        Thread.currentThread().interrupt();
                    }
                });

        try {
            DispatchResult result = interrupted.process(approvedQueue(), entry -> true, false);

            assertEquals(1, result.getSent());
            assertEquals(MessageStatus.APPROVED, store.message("m2").getStatus());
        } finally {
            // Clear the flag for the next test
            Thread.interrupted();
        }
    }

    @Test
    void testReviewThenDispatchRoundTrip() {
        store.addLead("lead-1", LeadStatus.MESSAGED);
        store.addMessage("m1", "lead-1", MessageChannel.EMAIL, "A", MessageStatus.PENDING);
        store.addMessage("m2", "lead-1", MessageChannel.EMAIL, "B", MessageStatus.PENDING);
        new MessageReviewService(store, new Random(7)).review(null);

        List<QueueEntry> sent = new ArrayList<>();
        DispatchResult result = dispatcher.process(approvedQueue(), sent::add, false);

        assertEquals(1, result.getSent());
        OutreachMessage delivered = store.message(sent.get(0).getMessageId());
        assertEquals(MessageStatus.SENT, delivered.getStatus());
        assertEquals(0, delivered.getRetryCount());
        assertEquals(LeadStatus.SENT, store.lead("lead-1").getStatus());
    }

    private DeliveryQueue approvedQueue() {
        DeliveryQueue queue = new DeliveryQueue(store, properties.getDelivery().getBatchSize());
        queue.fetchBatch(MessageStatus.APPROVED, null);
        return queue;
    }

    private DeliveryQueue failedQueue() {
        DeliveryQueue queue = new DeliveryQueue(store, properties.getDelivery().getBatchSize());
        queue.fetchBatch(MessageStatus.FAILED, null);
        return queue;
    }
}
