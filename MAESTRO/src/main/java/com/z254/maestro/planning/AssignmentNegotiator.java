package com.z254.maestro.planning;

import com.z254.maestro.domain.model.AgentCapabilityMatch;
import com.z254.maestro.domain.model.TaskRequirement;

import java.util.List;

/**
 * Hook for re-ranking or substituting candidates before a plan step is assigned.
 * Declare a bean of this type to replace the default pass-through.
 */
@FunctionalInterface
public interface AssignmentNegotiator {

    AssignmentNegotiator IDENTITY = (candidates, requirement) -> candidates;

    List<AgentCapabilityMatch> negotiate(List<AgentCapabilityMatch> candidates, TaskRequirement requirement);
}
