package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate task counters, either global or scoped to one owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskMetrics {

    private long totalTasks;
    private long completedTasks;
    private long failedTasks;

    /**
     * Mean time from dispatch to terminal outcome, in milliseconds.
     */
    private double averageCompletionTimeMs;

    /**
     * completed / (completed + failed), zero when nothing has finished yet.
     */
    private double successRate;

    public static double successRate(long completed, long failed) {
        long finished = completed + failed;
        return finished == 0 ? 0.0 : (double) completed / finished;
    }
}
