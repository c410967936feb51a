package com.z254.maestro.domain.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

import static com.z254.maestro.domain.message.MessagePayload.hasText;
import static com.z254.maestro.domain.message.MessagePayload.require;

/**
 * Work order sent to a worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchPayload implements MessagePayload {

    private String taskId;

    /**
     * Dispatch id the worker must echo back in its result.
     */
    private String stepId;

    private String capability;

    private String description;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    /**
     * 1-based attempt number.
     */
    @Builder.Default
    private int attempt = 1;

    /**
     * Latency ceiling the worker is expected to honour.
     */
    private long maxLatencyMs;

    @Override
    public void validate() {
        require(hasText(taskId), "dispatch requires taskId");
        require(hasText(stepId), "dispatch requires stepId");
        require(hasText(capability), "dispatch requires capability");
        require(attempt > 0, "dispatch attempt must be positive");
    }
}
