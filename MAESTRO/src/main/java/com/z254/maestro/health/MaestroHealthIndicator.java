package com.z254.maestro.health;

import com.z254.maestro.capability.CapabilityCatalog;
import com.z254.maestro.ledger.TaskLedger;
import com.z254.maestro.orchestration.TaskOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Health indicator for the orchestration core.
 * Reports queue depths, concurrency usage and catalog size; DOWN once the loop is gone.
 */
@Component
@Slf4j
public class MaestroHealthIndicator implements ReactiveHealthIndicator {

    private final TaskOrchestrator orchestrator;
    private final CapabilityCatalog catalog;
    private final TaskLedger ledger;
    private final Scheduler loop;

    public MaestroHealthIndicator(TaskOrchestrator orchestrator,
                                  CapabilityCatalog catalog,
                                  TaskLedger ledger,
                                  Scheduler orchestrationLoop) {
        this.orchestrator = orchestrator;
        this.catalog = catalog;
        this.ledger = ledger;
        this.loop = orchestrationLoop;
    }

    @Override
    public Mono<Health> health() {
        if (loop.isDisposed()) {
            return Mono.just(Health.down().withDetail("loop", "DISPOSED").build());
        }
        return orchestrator.getQueueStatus()
                .timeout(Duration.ofSeconds(5))
                .map(status -> Health.up()
                        .withDetail("loop", "RUNNING")
                        .withDetail("queue.high", status.high())
                        .withDetail("queue.medium", status.medium())
                        .withDetail("queue.low", status.low())
                        .withDetail("activeTasks", status.active())
                        .withDetail("maxConcurrentTasks", status.maxConcurrent())
                        .withDetail("catalogEntries", catalog.size())
                        .withDetail("liveTasks", ledger.liveTaskCount())
                        .build())
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
