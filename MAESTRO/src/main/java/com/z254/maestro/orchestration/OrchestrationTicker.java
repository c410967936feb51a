package com.z254.maestro.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the orchestrator's scheduling tick at a fixed interval.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "maestro.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrchestrationTicker {

    private final TaskOrchestrator orchestrator;

    public OrchestrationTicker(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
        log.info("Orchestration ticker enabled");
    }

    @Scheduled(fixedDelayString = "${maestro.scheduling.tick-interval:PT1S}")
    public void tick() {
        orchestrator.tick();
    }
}
