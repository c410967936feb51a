package com.z254.maestro.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Provides the single-threaded loop on which all orchestration state is mutated.
 */
@Slf4j
@Configuration
public class OrchestrationLoopConfig {

    public static final String LOOP_NAME = "maestro-loop";

    @Bean(destroyMethod = "dispose")
    public Scheduler orchestrationLoop() {
        log.info("Starting orchestration loop scheduler: {}", LOOP_NAME);
        return Schedulers.newSingle(LOOP_NAME);
    }
}
