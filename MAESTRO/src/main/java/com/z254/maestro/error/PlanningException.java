package com.z254.maestro.error;

/**
 * A collaboration plan cannot be built or executed as declared.
 */
public class PlanningException extends OrchestrationException {

    public static final String CODE = "PLAN_INVALID";

    public PlanningException(String message) {
        super(CODE, message, false);
    }
}
