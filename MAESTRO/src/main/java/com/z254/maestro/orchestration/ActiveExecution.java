package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.CollaborationPlan;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-flight attempt of one task: the dispatches awaiting a worker answer and, for complex
 * tasks, the plan being executed.
 */
@Getter
class ActiveExecution {

    private final String taskId;
    private final int attempt;
    private final Instant startedAt;
    private final Map<String, Dispatch> dispatches = new LinkedHashMap<>();

    @Setter
    private CollaborationPlan plan;

    ActiveExecution(String taskId, int attempt, Instant startedAt) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.startedAt = startedAt;
    }

    boolean isPlanned() {
        return plan != null;
    }

    void track(Dispatch dispatch) {
        dispatches.put(dispatch.dispatchId(), dispatch);
    }

    /**
     * Resolve the dispatch a worker result refers to. Results without a dispatch id
     * match only when exactly one dispatch is outstanding.
     */
    Dispatch resolve(String dispatchId) {
        if (dispatchId != null) {
            return dispatches.get(dispatchId);
        }
        return dispatches.size() == 1 ? dispatches.values().iterator().next() : null;
    }

    Dispatch release(String dispatchId) {
        return dispatches.remove(dispatchId);
    }

    Collection<Dispatch> outstanding() {
        return new ArrayList<>(dispatches.values());
    }

    /**
     * One message sent to one worker.
     *
     * @param planStepId null for single-step tasks
     */
    record Dispatch(String dispatchId, String planStepId, String agentId, String capability,
                    Instant dispatchedAt, long maxLatencyMs) {
    }
}
