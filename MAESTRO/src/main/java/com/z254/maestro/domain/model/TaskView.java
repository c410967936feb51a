package com.z254.maestro.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Sanitized, read-only projection of a task. Parameters are deliberately omitted.
 */
public record TaskView(
        String id,
        String ownerId,
        String description,
        String category,
        TaskPriority priority,
        TaskState state,
        List<String> requiredCapabilities,
        boolean complex,
        Object result,
        String error,
        int retryCount,
        int maxRetries,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {

    public static TaskView of(Task task) {
        return new TaskView(
                task.getId(),
                task.getOwnerId(),
                task.getDescription(),
                task.getCategory(),
                task.getPriority(),
                task.getState(),
                task.getRequiredCapabilities() != null ? List.copyOf(task.getRequiredCapabilities()) : List.of(),
                task.isComplex(),
                task.getResult(),
                task.getError(),
                task.getRetryCount(),
                task.getMaxRetries(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getStartedAt(),
                task.getCompletedAt());
    }
}
