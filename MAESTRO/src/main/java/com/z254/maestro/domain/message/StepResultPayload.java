package com.z254.maestro.domain.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.z254.maestro.domain.message.MessagePayload.hasText;
import static com.z254.maestro.domain.message.MessagePayload.require;

/**
 * Outcome of a dispatch reported by a worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepResultPayload implements MessagePayload {

    private String taskId;

    /**
     * Echo of the dispatch id. May be omitted for single-step tasks.
     */
    private String stepId;

    private Outcome outcome;

    private Object result;

    private String error;

    /**
     * Observed execution time, fed back into the catalog when present.
     */
    private Long latencyMs;

    @Override
    public void validate() {
        require(hasText(taskId), "step result requires taskId");
        require(outcome != null, "step result requires outcome");
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    public static StepResultPayload success(String taskId, String stepId, Object result) {
        return StepResultPayload.builder()
                .taskId(taskId)
                .stepId(stepId)
                .outcome(Outcome.SUCCEEDED)
                .result(result)
                .build();
    }

    public static StepResultPayload failure(String taskId, String stepId, String error) {
        return StepResultPayload.builder()
                .taskId(taskId)
                .stepId(stepId)
                .outcome(Outcome.FAILED)
                .error(error)
                .build();
    }

    public enum Outcome {

        SUCCEEDED,

        FAILED,

        /**
         * Worker needs an external signature before it can finish.
         */
        AWAITING_SIGNATURE,

        /**
         * Signature received, worker is confirming.
         */
        CONFIRMING
    }
}
