package com.leadpipeline.config;

import com.leadpipeline.agent.EnrichmentMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the pipeline, bound from {@code leadpipeline.*}
 */
@ConfigurationProperties(prefix = "leadpipeline")
@Getter
@Setter
public class PipelineProperties {

    private final Delivery delivery = new Delivery();
    private final Retry retry = new Retry();
    private final Pipeline pipeline = new Pipeline();

    @Getter
    @Setter
    public static class Delivery {
        /**
         * Max number of messages pulled into the queue per fetch.
         */
        private int batchSize = 50;

        /**
         * Upper bound on dispatches per minute.
         */
        private int maxPerMinute = 10;

        /**
         * Refill the queue when it holds fewer entries than this.
         */
        private int refillThreshold = 10;

        /**
         * Directory the simulated sender writes message files to.
         */
        private String storagePath = "storage/messages";

        private final Scheduler scheduler = new Scheduler();
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = false;

        /**
         * Fixed delay between scheduled send runs in milliseconds.
         */
        private long intervalMs = 60_000L;

        /**
         * Scheduled runs only simulate delivery unless this is turned off.
         */
        private boolean dryRun = true;
    }

    @Getter
    @Setter
    public static class Retry {
        /**
         * Failed deliveries allowed before a message stops being retried.
         * Governs both the state machine's halt check and the retry pass.
         */
        private int maxRetries = 2;
    }

    @Getter
    @Setter
    public static class Pipeline {
        private EnrichmentMode enrichmentMode = EnrichmentMode.INLINE;
    }
}
