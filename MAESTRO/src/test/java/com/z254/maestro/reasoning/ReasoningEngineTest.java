package com.z254.maestro.reasoning;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.ChainOfThoughtStep;
import com.z254.maestro.domain.model.ReasoningChain;
import com.z254.maestro.domain.model.StepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ReasoningEngine.
 */
class ReasoningEngineTest {

    private VirtualTimeScheduler loop;
    private MaestroProperties properties;
    private ReasoningEngine engine;

    @BeforeEach
    void setUp() {
        loop = VirtualTimeScheduler.create();
        properties = new MaestroProperties();
        engine = new ReasoningEngine(new ReasoningQualityScorer(), loop, properties);
    }

    @Nested
    @DisplayName("pattern selection")
    class PatternSelection {

        @Test
        void shouldPreferValidationForValidators() {
            assertThat(engine.selectPattern("validator", "strategic")).isEqualTo(ReasoningPattern.VALIDATION);
            assertThat(engine.selectPattern("executor", "validation")).isEqualTo(ReasoningPattern.VALIDATION);
        }

        @Test
        void shouldFollowDeclaredStyle() {
            assertThat(engine.selectPattern("executor", "strategic")).isEqualTo(ReasoningPattern.STRATEGIC);
            assertThat(engine.selectPattern("executor", "Analytical")).isEqualTo(ReasoningPattern.ANALYTICAL);
            assertThat(engine.selectPattern("planner", "react")).isEqualTo(ReasoningPattern.REACT);
        }

        @Test
        void shouldFallBackToRoleKeywordsThenReAct() {
            assertThat(engine.selectPattern("planner", null)).isEqualTo(ReasoningPattern.STRATEGIC);
            assertThat(engine.selectPattern("research analyst", "")).isEqualTo(ReasoningPattern.ANALYTICAL);
            assertThat(engine.selectPattern(null, null)).isEqualTo(ReasoningPattern.REACT);
        }
    }

    @Nested
    @DisplayName("chain generation")
    class ChainGeneration {

        @Test
        void shouldWalkPatternTemplatesUntilExhausted() {
            // Given
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "the balance check");

            // When
            ChainOfThoughtStep first = engine.generateNextStep(chain, null);
            engine.generateNextStep(chain, null);
            engine.generateNextStep(chain, null);
            ChainOfThoughtStep last = engine.generateNextStep(chain, null);
            ChainOfThoughtStep beyond = engine.generateNextStep(chain, null);

            // Then
            assertThat(chain.getPattern()).isEqualTo(ReasoningPattern.REACT.name());
            assertThat(first.getStepNumber()).isEqualTo(1);
            assertThat(first.getType()).isEqualTo(StepType.OBSERVATION);
            assertThat(first.getContent()).contains("the balance check");
            assertThat(last.getType()).isEqualTo(StepType.REFLECTION);
            assertThat(last.getConfidence()).isGreaterThan(first.getConfidence());
            assertThat(beyond).isNull();
            assertThat(chain.size()).isEqualTo(4);
        }

        @Test
        void shouldCycleThroughPatternWhenConfigured() {
            // Given
            properties.getReasoning().setMaxCycles(2);
            ReasoningChain chain = engine.startChain("agent-1", "executor", "react", "x");

            // When
            int generated = 0;
            while (engine.generateNextStep(chain, null) != null) {
                generated++;
            }

            // Then
            assertThat(generated).isEqualTo(8);
            assertThat(chain.getSteps().get(4).getLabel()).isEqualTo("observe");
        }

        @Test
        void shouldLetContextOverrideGeneratedValues() {
            // Given
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");

            // When
            ChainOfThoughtStep step = engine.generateNextStep(chain, Map.of(
                    ReasoningEngine.CONTEXT_CONTENT, "Balance is 10 ETH",
                    ReasoningEngine.CONTEXT_CONFIDENCE, 1.7));

            // Then
            assertThat(step.getContent()).isEqualTo("Balance is 10 ETH");
            assertThat(step.getConfidence()).isEqualTo(1.0);
            assertThat(step.getReasoning()).isNotBlank();
        }

        @Test
        void shouldRejectStepsOnFinalizedChain() {
            // Given
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");
            engine.generateNextStep(chain, null);
            engine.finalizeChain(chain);

            // When / Then
            assertThatThrownBy(() -> engine.generateNextStep(chain, null))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("continuation")
    class Continuation {

        @Test
        void shouldContinueShortChains() {
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");
            engine.generateNextStep(chain, null);

            assertThat(engine.shouldContinue(chain)).isTrue();
        }

        @Test
        void shouldStopAfterConcludingReflection() {
            // Given
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");
            for (int i = 0; i < 4; i++) {
                engine.generateNextStep(chain, null);
            }

            // Then
            assertThat(chain.lastStep().getContent()).contains("conclusion");
            assertThat(engine.shouldContinue(chain)).isFalse();
        }

        @Test
        void shouldContinueWhileRecentConfidenceIsLow() {
            // Given
            properties.getReasoning().setMaxCycles(3);
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");
            Map<String, Object> unsure = Map.of(ReasoningEngine.CONTEXT_CONFIDENCE, 0.4,
                    ReasoningEngine.CONTEXT_CONTENT, "Still unclear");

            // When
            for (int i = 0; i < 5; i++) {
                engine.generateNextStep(chain, unsure);
            }

            // Then
            assertThat(engine.shouldContinue(chain)).isTrue();
        }

        @Test
        void shouldCapChainLength() {
            // Given
            properties.getReasoning().setMaxCycles(3);
            ReasoningChain chain = engine.startChain("agent-1", "executor", null, "x");
            Map<String, Object> unsure = Map.of(ReasoningEngine.CONTEXT_CONFIDENCE, 0.4,
                    ReasoningEngine.CONTEXT_CONTENT, "Still unclear");

            // When
            for (int i = 0; i < ReasoningEngine.MAX_CHAIN_LENGTH; i++) {
                engine.generateNextStep(chain, unsure);
            }

            // Then
            assertThat(engine.shouldContinue(chain)).isFalse();
        }
    }

    @Test
    void shouldRunAndFinalizeFullChain() {
        // When
        ReasoningChain chain = engine.reason("planner-1", "planner", "strategic", "a token transfer", null);

        // Then
        assertThat(chain.isFinalized()).isTrue();
        assertThat(chain.size()).isEqualTo(ReasoningPattern.STRATEGIC.length());
        assertThat(chain.getQualityScore()).isBetween(0.0, 1.0);
        assertThat(chain.isNeedsReview()).isFalse();
        assertThat(engine.getHistory(5)).containsExactly(chain);
    }

    @Test
    void shouldStampChainsFromLoopClock() {
        // Given
        loop.advanceTimeBy(Duration.ofSeconds(30));

        // When
        ReasoningChain chain = engine.startChain("goat-mcp", "executor", null, "a balance check");
        ChainOfThoughtStep first = engine.generateNextStep(chain, null);
        loop.advanceTimeBy(Duration.ofSeconds(5));
        engine.finalizeChain(chain);

        // Then
        assertThat(chain.getStartedAt()).isEqualTo(Instant.EPOCH.plusSeconds(30));
        assertThat(first.getTimestamp()).isEqualTo(Instant.EPOCH.plusSeconds(30));
        assertThat(chain.getFinalizedAt()).isEqualTo(Instant.EPOCH.plusSeconds(35));
    }

    @Test
    void shouldBoundHistory() {
        // Given
        properties.getReasoning().setHistoryLimit(2);

        // When
        engine.reason("a", "executor", null, "one", null);
        ReasoningChain second = engine.reason("a", "executor", null, "two", null);
        ReasoningChain third = engine.reason("a", "executor", null, "three", null);

        // Then
        assertThat(engine.getHistory(10)).containsExactly(second, third);
    }
}
