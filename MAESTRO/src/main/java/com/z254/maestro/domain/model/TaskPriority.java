package com.z254.maestro.domain.model;

import java.util.Locale;

/**
 * Scheduling priority. Queues are drained strictly in declaration order.
 */
public enum TaskPriority {

    HIGH,
    MEDIUM,
    LOW;

    /**
     * Lenient parse, defaulting to {@link #MEDIUM} for unknown or blank values.
     */
    public static TaskPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
