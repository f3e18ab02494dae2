package com.leadpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpipeline.core.DispatchPacer;
import com.leadpipeline.core.SystemDispatchPacer;
import com.leadpipeline.sender.ChannelRoutingMessageSender;
import com.leadpipeline.sender.ChannelTransport;
import com.leadpipeline.sender.MessageSender;
import com.leadpipeline.sender.StorageMessageSender;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Wiring for the delivery pipeline
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Variant picker for review
     */
    @Bean
    public Random reviewRandom() {
        return new Random();
    }

    @Bean
    public DispatchPacer dispatchPacer() {
        return new SystemDispatchPacer();
    }

    /**
     * Dry-run sender: stores messages as JSON files
     */
    @Bean
    public MessageSender simulatedMessageSender(PipelineProperties properties, ObjectMapper objectMapper,
                                                Clock clock) {
        return new StorageMessageSender(Paths.get(properties.getDelivery().getStoragePath()),
                objectMapper, clock);
    }

    /**
     * Live sender over whatever {@link ChannelTransport} beans are present
     */
    @Bean
    public MessageSender liveMessageSender(ObjectProvider<ChannelTransport> transports) {
        return new ChannelRoutingMessageSender(transports.orderedStream().collect(Collectors.toList()));
    }
}
