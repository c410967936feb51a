package com.z254.maestro.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for task scheduling and message delivery.
 */
@Component
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    private final Counter tasksSubmitted;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksRetried;
    private final Counter tasksCancelled;
    private final Counter selectionFailures;
    private final Counter watchdogExpiries;
    private final Counter messagesPublished;
    private final Counter deliveryFailures;
    private final Timer taskDuration;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.tasksSubmitted = Counter.builder("maestro.tasks.submitted")
                .description("Tasks accepted by the orchestrator")
                .register(registry);
        this.tasksCompleted = Counter.builder("maestro.tasks.completed")
                .description("Tasks completed successfully")
                .register(registry);
        this.tasksFailed = Counter.builder("maestro.tasks.failed")
                .description("Tasks that reached FAILED")
                .register(registry);
        this.tasksRetried = Counter.builder("maestro.tasks.retried")
                .description("Attempts returned to a queue after a failure")
                .register(registry);
        this.tasksCancelled = Counter.builder("maestro.tasks.cancelled")
                .description("Tasks cancelled by an external signal")
                .register(registry);
        this.selectionFailures = Counter.builder("maestro.selection.failures")
                .description("Tasks for which no capable agent was found")
                .register(registry);
        this.watchdogExpiries = Counter.builder("maestro.watchdog.expired")
                .description("Dispatches failed for exceeding their latency ceiling")
                .register(registry);
        this.messagesPublished = Counter.builder("maestro.bus.published")
                .description("Messages accepted by the bus")
                .register(registry);
        this.deliveryFailures = Counter.builder("maestro.bus.delivery.failures")
                .description("Subscriber handlers that threw")
                .register(registry);
        this.taskDuration = Timer.builder("maestro.tasks.duration")
                .description("Time from first dispatch to terminal outcome")
                .register(registry);
    }

    public void taskSubmitted() {
        tasksSubmitted.increment();
    }

    public void taskCompleted(Duration duration) {
        tasksCompleted.increment();
        if (duration != null) {
            taskDuration.record(duration);
        }
    }

    public void taskFailed() {
        tasksFailed.increment();
    }

    public void taskRetried() {
        tasksRetried.increment();
    }

    public void taskCancelled() {
        tasksCancelled.increment();
    }

    public void selectionFailed() {
        selectionFailures.increment();
    }

    public void watchdogExpired() {
        watchdogExpiries.increment();
    }

    public void messagePublished() {
        messagesPublished.increment();
    }

    public void deliveryFailed() {
        deliveryFailures.increment();
    }

    /**
     * Registers a gauge backed by a live supplier.
     */
    public void gauge(String name, String description, Supplier<Number> value, String... tags) {
        Gauge.builder(name, value)
                .description(description)
                .tags(tags)
                .register(registry);
    }
}
