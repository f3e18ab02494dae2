package com.leadpipeline.core;

import com.leadpipeline.config.PipelineProperties;
import com.leadpipeline.model.DispatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically sends approved messages when {@code leadpipeline.delivery.scheduler.enabled} is set
 */
@Component
@ConditionalOnProperty(prefix = "leadpipeline.delivery.scheduler", name = "enabled", havingValue = "true")
@Slf4j
public class DeliveryScheduler {
    private final OutreachPipelineService pipelineService;
    private final PipelineProperties properties;

    public DeliveryScheduler(OutreachPipelineService pipelineService, PipelineProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${leadpipeline.delivery.scheduler.interval-ms:60000}")
    public void sendApproved() {
        if (pipelineService.isDispatching()) {
            log.debug("Dispatch run still active, skipping scheduled send");
            return;
        }
        try {
            DispatchResult result = pipelineService.sendApproved(properties.getDelivery().getScheduler().isDryRun());
            log.info("Scheduled send done: sent={} failed={} skipped={}",
                    result.getSent(), result.getFailed(), result.getSkipped());
        } catch (Exception e) {
            log.error("Error in scheduled send", e);
        }
    }
}
