package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-step execution graph for a complex task.
 * Held by the planner while the task runs and discarded afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaborationPlan {

    private String planId;
    private String taskId;

    @Builder.Default
    private List<PlanParticipant> participants = new ArrayList<>();

    /**
     * Steps in topological order.
     */
    @Builder.Default
    private List<ExecutionStep> steps = new ArrayList<>();

    @Builder.Default
    private List<ContingencyRule> contingencies = new ArrayList<>();

    /**
     * Mean score of the selected matches (0.0 - 1.0).
     */
    private double confidence;

    /**
     * True when no step depends on another.
     */
    private boolean parallelEligible;

    /**
     * Justification produced while planning.
     */
    @Builder.Default
    private List<String> reasoning = new ArrayList<>();

    /**
     * Quality score of the justification chain.
     */
    private double reasoningScore;

    private Instant createdAt;

    /**
     * Read-only copy for callers outside the orchestration loop. Step updates on the live plan do not reach it.
     */
    public CollaborationPlan snapshot() {
        return new CollaborationPlan(planId, taskId,
                List.copyOf(participants),
                steps.stream().map(ExecutionStep::copy).toList(),
                List.copyOf(contingencies),
                confidence, parallelEligible,
                List.copyOf(reasoning),
                reasoningScore, createdAt);
    }

    public Optional<ExecutionStep> getStep(String stepId) {
        return steps.stream().filter(s -> s.getId().equals(stepId)).findFirst();
    }

    public Set<String> completedStepIds() {
        return steps.stream()
                .filter(s -> s.getStatus() == StepStatus.COMPLETED)
                .map(ExecutionStep::getId)
                .collect(Collectors.toSet());
    }

    /**
     * Pending steps whose dependencies have all completed.
     */
    public List<ExecutionStep> readySteps() {
        Set<String> done = completedStepIds();
        return steps.stream()
                .filter(s -> s.getStatus() == StepStatus.PENDING)
                .filter(s -> s.dependenciesSatisfied(done))
                .toList();
    }

    public List<ExecutionStep> dispatchedSteps() {
        return steps.stream().filter(s -> s.getStatus() == StepStatus.DISPATCHED).toList();
    }

    public boolean isComplete() {
        return !steps.isEmpty() && steps.stream().allMatch(s -> s.getStatus() == StepStatus.COMPLETED);
    }

    /**
     * Step results keyed by step id, in plan order.
     */
    public Map<String, Object> results() {
        Map<String, Object> results = new LinkedHashMap<>();
        for (ExecutionStep step : steps) {
            if (step.getStatus() == StepStatus.COMPLETED) {
                results.put(step.getId(), step.getResult());
            }
        }
        return results;
    }
}
