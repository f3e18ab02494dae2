package com.leadpipeline.sender;

import com.leadpipeline.model.QueueEntry;

/**
 * Delivers one queued message.
 *
 * <p>Implementations report failure by returning {@code false} and must not throw.</p>
 */
public interface MessageSender {

    /**
     * @return true if the message was delivered (or stored, for simulated senders)
     */
    boolean send(QueueEntry entry);
}
