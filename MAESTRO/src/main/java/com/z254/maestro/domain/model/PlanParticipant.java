package com.z254.maestro.domain.model;

import java.util.List;

/**
 * A worker taking part in a collaboration plan.
 */
public record PlanParticipant(String agentId, Role role, List<String> capabilities) {

    public enum Role {
        PRIMARY,
        SECONDARY,
        FALLBACK,
        VALIDATOR
    }
}
