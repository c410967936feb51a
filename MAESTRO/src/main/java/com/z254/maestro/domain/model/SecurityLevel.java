package com.z254.maestro.domain.model;

/**
 * Security clearance advertised by a capability or required by a task.
 */
public enum SecurityLevel {

    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(SecurityLevel required) {
        return required == null || this.ordinal() >= required.ordinal();
    }
}
