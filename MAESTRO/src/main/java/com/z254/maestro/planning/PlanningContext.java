package com.z254.maestro.planning;

import com.z254.maestro.domain.model.SecurityLevel;

/**
 * Constraints the planner applies to every step of a plan.
 *
 * @param attempt 1-based attempt number of the task being planned
 */
public record PlanningContext(SecurityLevel securityLevel, long maxLatencyMs, int attempt) {
}
