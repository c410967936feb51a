package com.z254.maestro.error;

public class DuplicateTaskException extends OrchestrationException {

    public static final String CODE = "DUPLICATE_TASK";

    public DuplicateTaskException(String taskId) {
        super(CODE, "Task id already registered: " + taskId, false);
    }
}
