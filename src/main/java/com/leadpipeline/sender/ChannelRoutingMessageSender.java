package com.leadpipeline.sender;

import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.QueueEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Live sender that hands each entry to the transport registered for its channel
 */
@Slf4j
public class ChannelRoutingMessageSender implements MessageSender {
    private final Map<MessageChannel, ChannelTransport> transports = new EnumMap<>(MessageChannel.class);

    public ChannelRoutingMessageSender(Collection<ChannelTransport> transports) {
        for (ChannelTransport transport : transports) {
            ChannelTransport previous = this.transports.put(transport.channel(), transport);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate transport for channel " + transport.channel());
            }
            log.info("Registered {} transport: {}", transport.channel().getValue(),
                    transport.getClass().getSimpleName());
        }
    }

    @Override
    public boolean send(QueueEntry entry) {
        ChannelTransport transport = transports.get(entry.getChannel());
        if (transport == null) {
            log.error("No transport configured for channel {}, cannot send message {}",
                    entry.getChannel(), entry.getMessageId());
            return false;
        }

        try {
            boolean delivered = transport.deliver(entry);
            if (delivered) {
                log.info("[LIVE] Sent {} to {} ({})", entry.getChannel().getValue(),
                        entry.getLeadEmail(), entry.getLeadName());
            }
            return delivered;
        } catch (Exception e) {
            log.error("Error sending message {}: {}", entry.getMessageId(), e.getMessage(), e);
            return false;
        }
    }

    public boolean supports(MessageChannel channel) {
        return transports.containsKey(channel);
    }
}
