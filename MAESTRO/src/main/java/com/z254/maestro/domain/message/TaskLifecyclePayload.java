package com.z254.maestro.domain.message;

import com.z254.maestro.domain.model.TaskState;
import com.z254.maestro.domain.model.TaskView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.z254.maestro.domain.message.MessagePayload.hasText;
import static com.z254.maestro.domain.message.MessagePayload.require;

/**
 * Notification for downstream consumers about a task's lifecycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskLifecyclePayload implements MessagePayload {

    private String taskId;
    private String ownerId;
    private TaskState oldState;
    private TaskState newState;
    private TaskView task;
    private Object result;

    /**
     * Human-readable reason for failures and cancellations.
     */
    private String reason;

    @Override
    public void validate() {
        require(hasText(taskId), "lifecycle event requires taskId");
        require(task != null, "lifecycle event requires task view");
    }
}
