package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.CollaborationPlan;
import com.z254.maestro.domain.model.TaskMetrics;
import com.z254.maestro.domain.model.TaskRequest;
import com.z254.maestro.domain.model.TaskStatus;
import com.z254.maestro.domain.model.TaskView;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Top-level scheduler: accepts requests, queues them by priority, dispatches them to workers
 * within a concurrency cap, and reconciles worker results with the task ledger.
 */
public interface TaskOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Submission
    // --------------------------------------------------------------------------------------------

    /**
     * Register and classify a request. The task comes back QUEUED, or FAILED when no
     * registered agent can perform it.
     *
     * @param request The work request
     * @return Sanitized view of the registered task
     */
    Mono<TaskView> submitTask(TaskRequest request);

    /**
     * Cancel a queued or running task.
     *
     * @param taskId The task ID
     * @param reason Human-readable reason
     * @return The cancelled task; errors when the task is unknown or already finished
     */
    Mono<TaskView> cancelTask(String taskId, String reason);

    // --------------------------------------------------------------------------------------------
    // Scheduling
    // --------------------------------------------------------------------------------------------

    /**
     * Run one scheduling pass on the orchestration loop: expire overdue dispatches, then
     * dispatch queued tasks in priority order while below the concurrency cap.
     */
    void tick();

    Mono<QueueStatus> getQueueStatus();

    /**
     * @return Position of a queued task, or empty when it is not queued
     */
    Mono<QueuePosition> getQueuePosition(String taskId);

    // --------------------------------------------------------------------------------------------
    // Queries
    // --------------------------------------------------------------------------------------------

    /**
     * @return Status of a live or archived task, or empty if unknown
     */
    Mono<TaskStatus> getTaskStatus(String taskId);

    /**
     * @param ownerId Owner to scope to, or null for global metrics
     */
    Mono<TaskMetrics> getMetrics(String ownerId);

    /**
     * @return Plan of a running complex task, or empty
     */
    Mono<CollaborationPlan> getPlan(String taskId);

    /**
     * @param ownerId Owner to scope to, or null for every owner
     */
    Flux<TaskView> getActiveTasks(String ownerId);
}
