package com.z254.maestro.error;

/**
 * A worker reported failure or stopped responding. Retried up to the task's limit.
 */
public class TaskExecutionException extends OrchestrationException {

    public static final String CODE = "EXECUTION_FAILED";
    public static final String TIMEOUT_CODE = "EXECUTION_TIMEOUT";

    public TaskExecutionException(String message) {
        super(CODE, message, true);
    }

    private TaskExecutionException(String code, String message) {
        super(code, message, true);
    }

    public static TaskExecutionException timeout(String taskId, String agentId, long elapsedMs) {
        return new TaskExecutionException(TIMEOUT_CODE,
                "Worker " + agentId + " did not answer for task " + taskId + " within " + elapsedMs + "ms");
    }
}
