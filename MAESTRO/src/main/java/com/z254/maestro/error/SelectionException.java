package com.z254.maestro.error;

import java.util.List;

/**
 * No registered worker qualifies for a task. Never retried.
 */
public class SelectionException extends OrchestrationException {

    public static final String CODE = "NO_CAPABLE_AGENT";

    public SelectionException(String message) {
        super(CODE, message, false);
    }

    public static SelectionException noCapableAgent(String taskId, List<String> capabilities) {
        return new SelectionException("No capable agent found for task " + taskId
                + " requiring " + capabilities);
    }
}
