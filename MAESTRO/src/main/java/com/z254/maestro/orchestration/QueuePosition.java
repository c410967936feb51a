package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.TaskPriority;

import java.time.Instant;

/**
 * Where a queued task stands across all priority levels.
 *
 * @param position 1-based, counting every task that will be dispatched first
 */
public record QueuePosition(String taskId, TaskPriority priority, int position, Instant estimatedStart) {
}
