package com.z254.maestro.planning;

import com.z254.maestro.capability.CapabilityCatalog;
import com.z254.maestro.capability.CapabilityRouter;
import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.AgentCapabilityMatch;
import com.z254.maestro.domain.model.Capability;
import com.z254.maestro.domain.model.CollaborationPlan;
import com.z254.maestro.domain.model.ExecutionStep;
import com.z254.maestro.domain.model.PlanParticipant;
import com.z254.maestro.domain.model.SecurityLevel;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.error.PlanningException;
import com.z254.maestro.error.SelectionException;
import com.z254.maestro.reasoning.ReasoningEngine;
import com.z254.maestro.reasoning.ReasoningQualityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for CollaborationPlanner.
 */
class CollaborationPlannerTest {

    private static final PlanningContext CONTEXT = new PlanningContext(SecurityLevel.LOW, 15_000, 1);

    private VirtualTimeScheduler loop;
    private MaestroProperties properties;
    private CapabilityCatalog catalog;
    private CollaborationPlanner planner;

    @BeforeEach
    void setUp() {
        loop = VirtualTimeScheduler.create();
        properties = new MaestroProperties();
        properties.getRouting().getMessageTypes().put("balance_check", "check_balance");
        catalog = new CapabilityCatalog(properties);
        planner = newPlanner(Optional.empty());
    }

    private CollaborationPlanner newPlanner(Optional<AssignmentNegotiator> negotiator) {
        return new CollaborationPlanner(catalog, new CapabilityRouter(properties),
                new ReasoningEngine(new ReasoningQualityScorer(), loop, properties), loop, properties, negotiator);
    }

    private void register(String agentId, String name, double successRate, String... dependencies) {
        catalog.registerCapability(Capability.builder()
                .agentId(agentId)
                .name(name)
                .securityLevel(SecurityLevel.HIGH)
                .estimatedLatencyMs(1000)
                .successRate(successRate)
                .dependencies(new ArrayList<>(List.of(dependencies)))
                .build());
    }

    private static Task task(String description, String... capabilities) {
        return Task.builder()
                .id("task-1")
                .ownerId("user-1")
                .description(description)
                .requiredCapabilities(new ArrayList<>(List.of(capabilities)))
                .createdAt(Instant.now())
                .build();
    }

    @Nested
    @DisplayName("dependency layering")
    class Layering {

        @Test
        void shouldLayerStepsByDeclaredDependencies() {
            // Given
            register("goat-mcp", "wallet_connection", 0.95);
            register("goat-mcp", "balance_check", 0.9, "wallet_connection");
            register("transfer-agent", "token_transfer", 0.9, "wallet_connection");

            // When
            CollaborationPlan plan = planner.createPlan(
                    task("connect and move funds", "wallet_connection", "balance_check", "token_transfer"), CONTEXT);

            // Then
            ExecutionStep first = plan.getStep("step-1").orElseThrow();
            ExecutionStep second = plan.getStep("step-2").orElseThrow();
            ExecutionStep third = plan.getStep("step-3").orElseThrow();
            assertThat(first.getCapability()).isEqualTo("wallet_connection");
            assertThat(first.getDependencies()).isEmpty();
            assertThat(first.isParallel()).isFalse();
            assertThat(second.getDependencies()).containsExactly("step-1");
            assertThat(third.getDependencies()).containsExactly("step-1");
            assertThat(second.isParallel()).isTrue();
            assertThat(third.isParallel()).isTrue();
            assertThat(plan.isParallelEligible()).isFalse();
            assertThat(plan.readySteps()).extracting(ExecutionStep::getId).containsExactly("step-1");
        }

        @Test
        void shouldReleaseDependentsOnceUpstreamCompletes() {
            // Given
            register("goat-mcp", "wallet_connection", 0.95);
            register("goat-mcp", "balance_check", 0.9, "wallet_connection");
            register("transfer-agent", "token_transfer", 0.9, "wallet_connection");
            CollaborationPlan plan = planner.createPlan(
                    task("connect and move funds", "wallet_connection", "balance_check", "token_transfer"), CONTEXT);

            // When
            plan.getStep("step-1").orElseThrow().markDispatched("d1", Instant.now());
            plan.getStep("step-1").orElseThrow().markCompleted("connected", Instant.now());

            // Then
            assertThat(plan.readySteps()).extracting(ExecutionStep::getId).containsExactlyInAnyOrder("step-2", "step-3");
        }

        @Test
        void shouldChainStepsWhenDescriptionAsksForSequence() {
            // Given
            register("a", "research", 0.9);
            register("b", "summarize", 0.9);

            // When
            CollaborationPlan plan = planner.createPlan(
                    task("research the protocol then summarize it", "research", "summarize"), CONTEXT);

            // Then
            assertThat(plan.getStep("step-2").orElseThrow().getDependencies()).containsExactly("step-1");
        }

        @Test
        void shouldRunIndependentStepsConcurrently() {
            // Given
            register("a", "research", 0.9);
            register("b", "summarize", 0.9);

            // When
            CollaborationPlan plan = planner.createPlan(task("research and summarize", "research", "summarize"), CONTEXT);

            // Then
            assertThat(plan.isParallelEligible()).isTrue();
            assertThat(plan.getSteps()).allMatch(ExecutionStep::isParallel);
            assertThat(plan.readySteps()).hasSize(2);
        }

        @Test
        void shouldRejectDependencyCycles() {
            // Given
            register("a", "alpha", 0.9, "beta");
            register("b", "beta", 0.9, "alpha");

            // When / Then
            assertThatThrownBy(() -> planner.createPlan(task("loop", "alpha", "beta"), CONTEXT))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("cycle");
            assertThat(planner.getActivePlan("task-1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("assignment")
    class Assignment {

        @Test
        void shouldFailWhenACapabilityHasNoAgent() {
            register("a", "research", 0.9);

            assertThatThrownBy(() -> planner.createPlan(task("x", "research", "missing"), CONTEXT))
                    .isInstanceOf(SelectionException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldFailWhenTaskNamesNoCapability() {
            assertThatThrownBy(() -> planner.createPlan(task("x"), CONTEXT))
                    .isInstanceOf(PlanningException.class);
        }

        @Test
        void shouldRecordRunnerUpAsContingency() {
            // Given
            register("best", "research", 0.95);
            register("backup", "research", 0.6);
            register("writer", "summarize", 0.9);

            // When
            CollaborationPlan plan = planner.createPlan(task("research and summarize", "research", "summarize"), CONTEXT);

            // Then
            assertThat(plan.getStep("step-1").orElseThrow().getAgentId()).isEqualTo("best");
            assertThat(plan.getContingencies()).singleElement().satisfies(rule -> {
                assertThat(rule.stepId()).isEqualTo("step-1");
                assertThat(rule.fallbackAgentId()).isEqualTo("backup");
            });
            assertThat(plan.getParticipants())
                    .extracting(PlanParticipant::agentId, PlanParticipant::role)
                    .containsExactly(
                            tuple("best", PlanParticipant.Role.PRIMARY),
                            tuple("writer", PlanParticipant.Role.SECONDARY),
                            tuple("backup", PlanParticipant.Role.FALLBACK));
        }

        @Test
        void shouldAppendValidatorAfterSinkSteps() {
            // Given
            register("a", "research", 0.9);
            register("b", "summarize", 0.9);
            register("auditor", "validation", 0.99);

            // When
            CollaborationPlan plan = planner.createPlan(
                    task("research the protocol then summarize it", "research", "summarize"), CONTEXT);

            // Then
            ExecutionStep validator = plan.getStep("step-3").orElseThrow();
            assertThat(validator.getCapability()).isEqualTo("validation");
            assertThat(validator.getDependencies()).containsExactly("step-2");
            assertThat(plan.getParticipants()).anySatisfy(p -> {
                assertThat(p.agentId()).isEqualTo("auditor");
                assertThat(p.role()).isEqualTo(PlanParticipant.Role.VALIDATOR);
            });
        }

        @Test
        void shouldUseConfiguredDispatchTopicAsAction() {
            // Given
            register("goat-mcp", "balance_check", 0.9);
            register("b", "summarize", 0.9);

            // When
            CollaborationPlan plan = planner.createPlan(task("x", "balance_check", "summarize"), CONTEXT);

            // Then
            assertThat(plan.getStep("step-1").orElseThrow().getAction()).isEqualTo("check_balance");
            assertThat(plan.getStep("step-2").orElseThrow().getAction()).isEqualTo("execute_task");
        }

        @Test
        void shouldLetNegotiatorReorderCandidates() {
            // Given
            register("best", "research", 0.95);
            register("backup", "research", 0.6);
            register("writer", "summarize", 0.9);
            AssignmentNegotiator preferBackup = (candidates, requirement) -> candidates.stream()
                    .sorted((l, r) -> l.agentId().equals("backup") ? -1 : r.agentId().equals("backup") ? 1 : 0)
                    .toList();
            CollaborationPlanner negotiating = newPlanner(Optional.of(preferBackup));

            // When
            CollaborationPlan plan = negotiating.createPlan(task("x", "research", "summarize"), CONTEXT);

            // Then
            assertThat(plan.getStep("step-1").orElseThrow().getAgentId()).isEqualTo("backup");
        }
    }

    @Test
    void shouldTrackActivePlansWithReasoning() {
        // Given
        register("a", "research", 0.9);
        register("b", "summarize", 0.9);

        loop.advanceTimeBy(Duration.ofMinutes(2));

        // When
        CollaborationPlan plan = planner.createPlan(task("research and summarize", "research", "summarize"), CONTEXT);

        // Then
        assertThat(plan.getCreatedAt()).isEqualTo(Instant.EPOCH.plusSeconds(120));
        assertThat(planner.getActivePlan("task-1")).contains(plan);
        assertThat(plan.getConfidence()).isBetween(0.0, 1.0);
        assertThat(plan.getReasoning()).anyMatch(line -> line.startsWith("[situation]"));
        assertThat(plan.getReasoningScore()).isPositive();
        assertThat(planner.removePlan("task-1")).isTrue();
        assertThat(planner.getActivePlans()).isEmpty();
    }

    @Test
    void shouldPassCandidatesThroughByDefault() {
        List<AgentCapabilityMatch> none = planner.negotiateAssignment(List.of(), null);

        assertThat(none).isEmpty();
    }
}
