package com.z254.maestro.domain.model;

/**
 * Status of a single step in a collaboration plan.
 */
public enum StepStatus {

    /**
     * Waiting for its dependencies or for dispatch.
     */
    PENDING,

    /**
     * Sent to its worker, completion outstanding.
     */
    DISPATCHED,

    /**
     * Worker reported success.
     */
    COMPLETED,

    /**
     * Worker reported failure.
     */
    FAILED
}
