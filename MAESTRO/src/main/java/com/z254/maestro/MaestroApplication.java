package com.z254.maestro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * MAESTRO - multi-agent task orchestration core.
 *
 * <p>MAESTRO provides:
 * <ul>
 *   <li>Message Bus - topic and targeted delivery between the orchestrator and workers</li>
 *   <li>Capability Catalog - scored agent selection from advertised capabilities</li>
 *   <li>Task Ledger - lifecycle state machine, archival and owner metrics</li>
 *   <li>Collaboration Planner - multi-agent plans with dependency layering</li>
 *   <li>Reasoning Engine - pattern-based reasoning chains with quality scoring</li>
 *   <li>Orchestrator - prioritized queues, bounded concurrency and retries</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class MaestroApplication {

    public static void main(String[] args) {
        SpringApplication.run(MaestroApplication.class, args);
    }
}
