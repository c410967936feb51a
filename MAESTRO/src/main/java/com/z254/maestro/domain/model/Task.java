package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of requested work.
 * Records are owned by the task ledger; callers only ever see copies or {@link TaskView}s.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    /**
     * Unique, immutable identifier.
     */
    private String id;

    /**
     * Identifier of the requester owning this task.
     */
    private String ownerId;

    /**
     * Free-text description of the requested work.
     */
    private String description;

    /**
     * Category used for routing and duration estimates.
     */
    private String category;

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Builder.Default
    private TaskState state = TaskState.NEW;

    /**
     * Structured input for the worker. Never exposed in sanitized views.
     */
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    /**
     * Capabilities needed to perform the task, in execution order.
     */
    @Builder.Default
    private List<String> requiredCapabilities = new ArrayList<>();

    /**
     * Minimum security level a worker must advertise.
     */
    @Builder.Default
    private SecurityLevel securityLevel = SecurityLevel.LOW;

    /**
     * Whether the task needs a collaboration plan.
     */
    private boolean complex;

    /**
     * Result payload, present only once COMPLETED.
     */
    private Object result;

    /**
     * Failure reason, present only once FAILED.
     */
    private String error;

    private int retryCount;

    @Builder.Default
    private int maxRetries = 3;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    /**
     * True when another attempt is allowed after a failure already counted in retryCount.
     */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /**
     * Time spent between dispatch and completion, if both are known.
     */
    public Duration getExecutionDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Deep enough copy to hand out without exposing ledger-owned collections.
     */
    public Task copy() {
        return toBuilder()
                .parameters(parameters != null ? new HashMap<>(parameters) : new HashMap<>())
                .requiredCapabilities(requiredCapabilities != null ? new ArrayList<>(requiredCapabilities) : new ArrayList<>())
                .build();
    }
}
