package com.z254.maestro.error;

public class TaskNotFoundException extends OrchestrationException {

    public static final String CODE = "TASK_NOT_FOUND";

    public TaskNotFoundException(String taskId) {
        super(CODE, "Task not found: " + taskId, false);
    }
}
