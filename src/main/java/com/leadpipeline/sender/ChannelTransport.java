package com.leadpipeline.sender;

import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.QueueEntry;

/**
 * A live transport for one channel, e.g. SMTP for email. Unlike {@link MessageSender}
 * a transport may throw; {@link ChannelRoutingMessageSender} turns that into a failure.
 */
public interface ChannelTransport {

    MessageChannel channel();

    boolean deliver(QueueEntry entry) throws Exception;
}
