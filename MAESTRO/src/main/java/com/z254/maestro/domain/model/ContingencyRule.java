package com.z254.maestro.domain.model;

/**
 * Fallback to consider when a plan step fails.
 */
public record ContingencyRule(String stepId, String condition, String fallbackAgentId, String capability) {
}
