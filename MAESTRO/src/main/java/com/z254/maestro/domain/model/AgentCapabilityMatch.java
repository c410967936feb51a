package com.z254.maestro.domain.model;

/**
 * Ranked candidate for a task, produced per selection and never stored.
 *
 * @param score clamped to [0, 1]
 */
public record AgentCapabilityMatch(String agentId, Capability capability, double score, String reasoning) {

    public String capabilityName() {
        return capability.getName();
    }
}
