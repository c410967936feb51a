package com.z254.maestro.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Per-owner overview of live and archived tasks.
 *
 * @param recentActivity the five most recently updated tasks, newest first
 */
public record OwnerTaskSummary(
        String ownerId,
        int total,
        int active,
        int completed,
        Map<TaskState, Integer> byState,
        Map<String, Integer> byCategory,
        List<TaskView> recentActivity
) {
}
