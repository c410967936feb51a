package com.z254.maestro.planning;

import com.z254.maestro.capability.CapabilityCatalog;
import com.z254.maestro.capability.CapabilityRouter;
import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.AgentCapabilityMatch;
import com.z254.maestro.domain.model.ChainOfThoughtStep;
import com.z254.maestro.domain.model.CollaborationPlan;
import com.z254.maestro.domain.model.ContingencyRule;
import com.z254.maestro.domain.model.ExecutionStep;
import com.z254.maestro.domain.model.PlanParticipant;
import com.z254.maestro.domain.model.PlanParticipant.Role;
import com.z254.maestro.domain.model.ReasoningChain;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.domain.model.TaskRequirement;
import com.z254.maestro.error.PlanningException;
import com.z254.maestro.error.SelectionException;
import com.z254.maestro.reasoning.ReasoningEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Builds multi-step execution plans for complex tasks.
 * <p>
 * Each required capability becomes one step assigned to the best catalog match. Step order comes from
 * the capabilities' declared dependencies, or from the order they were requested in when the task
 * spells out a sequence. Steps sharing a dependency layer may run concurrently.
 */
@Service
@Slf4j
public class CollaborationPlanner {

    static final String PLANNER_ID = "collaboration-planner";

    private final CapabilityCatalog catalog;
    private final CapabilityRouter router;
    private final ReasoningEngine reasoningEngine;
    private final AssignmentNegotiator negotiator;
    private final Scheduler loop;
    private final String validatorCapability;

    // Active plans by task id
    private final Map<String, CollaborationPlan> activePlans = new ConcurrentHashMap<>();

    public CollaborationPlanner(CapabilityCatalog catalog,
                                CapabilityRouter router,
                                ReasoningEngine reasoningEngine,
                                Scheduler orchestrationLoop,
                                MaestroProperties properties,
                                Optional<AssignmentNegotiator> negotiator) {
        this.catalog = catalog;
        this.router = router;
        this.reasoningEngine = reasoningEngine;
        this.loop = orchestrationLoop;
        this.negotiator = negotiator.orElse(AssignmentNegotiator.IDENTITY);
        this.validatorCapability = properties.getPlanning().getValidatorCapability();
    }

    /**
     * Build and register a plan for a task, replacing any previous plan for it.
     *
     * @throws SelectionException when a required capability has no qualifying agent
     * @throws PlanningException  when the task names no capability or the dependencies form a cycle
     */
    public CollaborationPlan createPlan(Task task, PlanningContext context) {
        List<String> capabilities = new ArrayList<>(new LinkedHashSet<>(task.getRequiredCapabilities()));
        if (capabilities.isEmpty()) {
            throw new PlanningException("Task " + task.getId() + " names no capability to plan for");
        }

        String planId = UUID.randomUUID().toString();
        Map<String, ExecutionStep> stepsByCapability = new LinkedHashMap<>();
        Map<String, AgentCapabilityMatch> chosen = new LinkedHashMap<>();
        List<ContingencyRule> contingencies = new ArrayList<>();

        for (String capability : capabilities) {
            List<AgentCapabilityMatch> candidates = rankCandidates(capability, context);
            if (candidates.isEmpty()) {
                throw SelectionException.noCapableAgent(task.getId(), List.of(capability));
            }
            AgentCapabilityMatch best = candidates.get(0);
            ExecutionStep step = newStep(task, capability, best, stepsByCapability.size() + 1);
            stepsByCapability.put(capability, step);
            chosen.put(step.getId(), best);
            fallbackFor(step, candidates).ifPresent(contingencies::add);
        }

        wireDependencies(task, capabilities, stepsByCapability);
        addValidatorStep(task, context, stepsByCapability, chosen);

        List<ExecutionStep> ordered = layer(task.getId(), stepsByCapability.values());
        boolean parallelEligible = ordered.stream().allMatch(s -> s.getDependencies().isEmpty());
        double confidence = chosen.values().stream().mapToDouble(AgentCapabilityMatch::score).average().orElse(0.0);

        ReasoningChain justification = reasoningEngine.reason(PLANNER_ID, "planner", "strategic",
                describe(task), null);
        List<String> reasoning = new ArrayList<>();
        for (ChainOfThoughtStep thought : justification.getSteps()) {
            reasoning.add("[" + thought.getLabel() + "] " + thought.getContent());
        }
        for (ExecutionStep step : ordered) {
            reasoning.add(step.getId() + ": " + chosen.get(step.getId()).reasoning());
        }

        CollaborationPlan plan = CollaborationPlan.builder()
                .planId(planId)
                .taskId(task.getId())
                .participants(participants(ordered, contingencies, capabilities))
                .steps(ordered)
                .contingencies(contingencies)
                .confidence(confidence)
                .parallelEligible(parallelEligible)
                .reasoning(reasoning)
                .reasoningScore(justification.getQualityScore() != null ? justification.getQualityScore() : 0.0)
                .createdAt(Instant.ofEpochMilli(loop.now(TimeUnit.MILLISECONDS)))
                .build();

        activePlans.put(task.getId(), plan);
        log.info("Created plan {} for task {}: {} steps, confidence {}, parallel-eligible {}",
                planId, task.getId(), ordered.size(), String.format("%.2f", confidence), parallelEligible);
        return plan;
    }

    /**
     * Re-rank or substitute candidates before assignment. Pass-through unless a negotiator bean is present.
     */
    public List<AgentCapabilityMatch> negotiateAssignment(List<AgentCapabilityMatch> candidates,
                                                          TaskRequirement requirement) {
        List<AgentCapabilityMatch> negotiated = negotiator.negotiate(candidates, requirement);
        return negotiated != null ? negotiated : List.of();
    }

    /**
     * Snapshot of the plan held for a task.
     */
    public Optional<CollaborationPlan> getActivePlan(String taskId) {
        return Optional.ofNullable(activePlans.get(taskId)).map(CollaborationPlan::snapshot);
    }

    public List<CollaborationPlan> getActivePlans() {
        return activePlans.values().stream().map(CollaborationPlan::snapshot).toList();
    }

    public boolean removePlan(String taskId) {
        return activePlans.remove(taskId) != null;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private List<AgentCapabilityMatch> rankCandidates(String capability, PlanningContext context) {
        TaskRequirement requirement = TaskRequirement.of(capability, context.securityLevel(), context.maxLatencyMs());
        return negotiateAssignment(catalog.findBestAgentsForTask(requirement), requirement);
    }

    private ExecutionStep newStep(Task task, String capability, AgentCapabilityMatch match, int sequence) {
        Map<String, Object> inputs = new HashMap<>();
        if (task.getParameters() != null) {
            inputs.putAll(task.getParameters());
        }
        inputs.put("description", task.getDescription());
        return ExecutionStep.builder()
                .id("step-" + sequence)
                .sequenceNumber(sequence)
                .agentId(match.agentId())
                .capability(capability)
                .action(router.dispatchTypeFor(capability).getTopic())
                .inputs(inputs)
                .build();
    }

    private Optional<ContingencyRule> fallbackFor(ExecutionStep step, List<AgentCapabilityMatch> candidates) {
        return candidates.stream()
                .filter(c -> !c.agentId().equals(step.getAgentId()))
                .findFirst()
                .map(c -> new ContingencyRule(step.getId(), step.getId() + " fails", c.agentId(), step.getCapability()));
    }

    /**
     * Catalog dependencies first; a plain chain in request order when there are none and the
     * description asks for a sequence.
     */
    private void wireDependencies(Task task, List<String> capabilities, Map<String, ExecutionStep> steps) {
        boolean anyDeclared = false;
        for (String capability : capabilities) {
            ExecutionStep step = steps.get(capability);
            Set<String> declared = new LinkedHashSet<>();
            catalog.getCapability(step.getAgentId(), capability)
                    .ifPresent(c -> declared.addAll(c.getDependencies()));
            for (String dependency : declared) {
                ExecutionStep upstream = steps.get(dependency);
                if (upstream != null && upstream != step) {
                    step.getDependencies().add(upstream.getId());
                    anyDeclared = true;
                }
            }
        }
        if (!anyDeclared && TaskComplexity.hasSequencingLanguage(task.getDescription())) {
            ExecutionStep previous = null;
            for (String capability : capabilities) {
                ExecutionStep step = steps.get(capability);
                if (previous != null) {
                    step.getDependencies().add(previous.getId());
                }
                previous = step;
            }
        }
    }

    private void addValidatorStep(Task task, PlanningContext context, Map<String, ExecutionStep> steps,
                                  Map<String, AgentCapabilityMatch> chosen) {
        if (validatorCapability == null || steps.containsKey(validatorCapability) || steps.size() < 2
                || !catalog.hasCapability(validatorCapability)) {
            return;
        }
        List<AgentCapabilityMatch> candidates = rankCandidates(validatorCapability, context);
        if (candidates.isEmpty()) {
            log.debug("No validator within constraints for task {}", task.getId());
            return;
        }
        Set<String> upstream = new LinkedHashSet<>();
        steps.values().forEach(s -> upstream.add(s.getId()));
        steps.values().forEach(s -> upstream.removeAll(s.getDependencies()));

        ExecutionStep validator = newStep(task, validatorCapability, candidates.get(0), steps.size() + 1);
        validator.getDependencies().addAll(upstream);
        steps.put(validatorCapability, validator);
        chosen.put(validator.getId(), candidates.get(0));
    }

    /**
     * Kahn layering. Returns the steps in topological order with their parallel flags set.
     */
    private List<ExecutionStep> layer(String taskId, Collection<ExecutionStep> steps) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<ExecutionStep>> dependents = new HashMap<>();
        for (ExecutionStep step : steps) {
            inDegree.put(step.getId(), step.getDependencies().size());
            for (String dependency : step.getDependencies()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(step);
            }
        }

        List<ExecutionStep> ordered = new ArrayList<>();
        Deque<ExecutionStep> current = new ArrayDeque<>();
        steps.stream().filter(s -> s.getDependencies().isEmpty()).forEach(current::add);
        while (!current.isEmpty()) {
            List<ExecutionStep> layer = new ArrayList<>(current);
            current.clear();
            for (ExecutionStep step : layer) {
                step.setParallel(layer.size() > 1);
                ordered.add(step);
                for (ExecutionStep dependent : dependents.getOrDefault(step.getId(), List.of())) {
                    if (inDegree.merge(dependent.getId(), -1, Integer::sum) == 0) {
                        current.add(dependent);
                    }
                }
            }
        }

        if (ordered.size() != steps.size()) {
            List<String> cyclic = steps.stream()
                    .filter(s -> !ordered.contains(s))
                    .map(s -> s.getId() + "(" + s.getCapability() + ")")
                    .toList();
            throw new PlanningException("Dependency cycle in plan for task " + taskId + " among " + cyclic);
        }
        return ordered;
    }

    private List<PlanParticipant> participants(List<ExecutionStep> steps, List<ContingencyRule> contingencies,
                                               List<String> requested) {
        Map<String, PlanParticipant> byAgent = new LinkedHashMap<>();
        for (ExecutionStep step : steps) {
            Role role;
            if (byAgent.isEmpty()) {
                role = Role.PRIMARY;
            } else if (!requested.contains(step.getCapability())) {
                role = Role.VALIDATOR;
            } else {
                role = Role.SECONDARY;
            }
            PlanParticipant existing = byAgent.get(step.getAgentId());
            if (existing == null) {
                byAgent.put(step.getAgentId(),
                        new PlanParticipant(step.getAgentId(), role, new ArrayList<>(List.of(step.getCapability()))));
            } else if (!existing.capabilities().contains(step.getCapability())) {
                existing.capabilities().add(step.getCapability());
            }
        }
        for (ContingencyRule rule : contingencies) {
            byAgent.computeIfAbsent(rule.fallbackAgentId(),
                    id -> new PlanParticipant(id, Role.FALLBACK, new ArrayList<>(List.of(rule.capability()))));
        }
        return new ArrayList<>(byAgent.values());
    }

    private static String describe(Task task) {
        String description = task.getDescription();
        if (description == null || description.isBlank()) {
            return "task " + task.getId();
        }
        return description.length() > 80 ? description.substring(0, 80) + "..." : description;
    }
}
