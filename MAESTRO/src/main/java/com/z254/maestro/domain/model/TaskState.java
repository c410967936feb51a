package com.z254.maestro.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a task tracked by the ledger.
 */
public enum TaskState {

    /**
     * Task has been registered but not yet analyzed.
     */
    NEW(0.0),

    /**
     * Task is being classified and checked for feasibility.
     */
    ANALYZING(0.1),

    /**
     * Task passed analysis and is cleared for scheduling.
     */
    APPROVED(0.2),

    /**
     * Task sits in a priority queue waiting for a free slot.
     */
    QUEUED(0.3),

    /**
     * Task has been dispatched to one or more workers.
     */
    RUNNING(0.6),

    /**
     * Worker is waiting for an external signature before it can proceed.
     */
    AWAITING_SIGN(0.8),

    /**
     * External approval was given, worker is confirming the outcome.
     */
    CONFIRMING(0.9),

    /**
     * Task completed successfully.
     */
    COMPLETED(1.0),

    /**
     * Task failed permanently.
     */
    FAILED(0.0),

    /**
     * Task was cancelled by an external signal.
     */
    CANCELLED(0.0);

    private final double progress;

    TaskState(double progress) {
        this.progress = progress;
    }

    /**
     * Fraction of the lifecycle covered once a task reaches this state.
     */
    public double getProgress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * True while a worker holds the task (it counts against the concurrency cap).
     */
    public boolean isActive() {
        return this == RUNNING || this == AWAITING_SIGN || this == CONFIRMING;
    }

    /**
     * States directly reachable from this one.
     */
    public Set<TaskState> successors() {
        if (isTerminal()) {
            return EnumSet.noneOf(TaskState.class);
        }
        EnumSet<TaskState> next = switch (this) {
            case NEW -> EnumSet.of(ANALYZING, APPROVED, QUEUED);
            case ANALYZING -> EnumSet.of(APPROVED, QUEUED);
            case APPROVED -> EnumSet.of(QUEUED);
            case QUEUED -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(AWAITING_SIGN, COMPLETED, QUEUED);
            case AWAITING_SIGN -> EnumSet.of(CONFIRMING, QUEUED);
            case CONFIRMING -> EnumSet.of(COMPLETED, QUEUED);
            default -> EnumSet.noneOf(TaskState.class);
        };
        next.add(FAILED);
        next.add(CANCELLED);
        return next;
    }

    public boolean canTransitionTo(TaskState target) {
        return target != null && successors().contains(target);
    }
}
