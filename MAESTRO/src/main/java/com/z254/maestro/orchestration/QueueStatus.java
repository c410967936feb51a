package com.z254.maestro.orchestration;

/**
 * Snapshot of the scheduler's queues and active set.
 */
public record QueueStatus(int high, int medium, int low, int active, int maxConcurrent) {

    public int queued() {
        return high + medium + low;
    }
}
