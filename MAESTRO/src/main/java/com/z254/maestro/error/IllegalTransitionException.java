package com.z254.maestro.error;

import com.z254.maestro.domain.model.TaskState;

/**
 * A state change that the task lifecycle does not allow.
 */
public class IllegalTransitionException extends OrchestrationException {

    public static final String CODE = "ILLEGAL_TRANSITION";

    private final String taskId;
    private final TaskState from;
    private final TaskState to;

    public IllegalTransitionException(String taskId, TaskState from, TaskState to) {
        super(CODE, "Task " + taskId + " cannot move from " + from + " to " + to, false);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getFrom() {
        return from;
    }

    public TaskState getTo() {
        return to;
    }
}
