package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One worker call inside a collaboration plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStep {

    /**
     * Step identifier, unique within its plan.
     */
    private String id;

    private int sequenceNumber;

    /**
     * Worker that must perform the step.
     */
    private String agentId;

    /**
     * Capability invoked on the worker.
     */
    private String capability;

    /**
     * Topic of the message the worker receives, e.g. {@code execute_task}.
     */
    private String action;

    @Builder.Default
    private Map<String, Object> inputs = new HashMap<>();

    /**
     * Ids of steps that must complete first.
     */
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    /**
     * Whether the step shares its dependency layer with other steps.
     */
    private boolean parallel;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    /**
     * Id of the dispatch currently in flight for this step.
     */
    private String dispatchId;

    private Object result;
    private String error;
    private Instant dispatchedAt;
    private Instant completedAt;

    /**
     * Detached copy with read-only inputs and dependencies.
     */
    public ExecutionStep copy() {
        return new ExecutionStep(id, sequenceNumber, agentId, capability, action,
                inputs != null ? Collections.unmodifiableMap(new HashMap<>(inputs)) : Map.of(),
                dependencies != null ? List.copyOf(dependencies) : List.of(),
                parallel, status, dispatchId, result, error, dispatchedAt, completedAt);
    }

    public boolean dependenciesSatisfied(Set<String> completedStepIds) {
        return dependencies == null || completedStepIds.containsAll(dependencies);
    }

    public void markDispatched(String dispatchId, Instant now) {
        this.dispatchId = dispatchId;
        this.status = StepStatus.DISPATCHED;
        this.dispatchedAt = now;
    }

    public void markCompleted(Object result, Instant now) {
        this.result = result;
        this.status = StepStatus.COMPLETED;
        this.completedAt = now;
    }

    public void markFailed(String error, Instant now) {
        this.error = error;
        this.status = StepStatus.FAILED;
        this.completedAt = now;
    }
}
