package com.z254.maestro.domain.model;

import java.time.Instant;

/**
 * Status answer for a single task: sanitized record, progress and completion estimate.
 *
 * @param estimatedCompletion null for terminal tasks
 */
public record TaskStatus(TaskView task, double progress, Instant estimatedCompletion, boolean archived) {
}
