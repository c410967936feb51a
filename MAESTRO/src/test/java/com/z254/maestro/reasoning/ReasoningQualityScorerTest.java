package com.z254.maestro.reasoning;

import com.z254.maestro.domain.model.ChainOfThoughtStep;
import com.z254.maestro.domain.model.ReasoningChain;
import com.z254.maestro.domain.model.StepType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for ReasoningQualityScorer.
 */
class ReasoningQualityScorerTest {

    private final ReasoningQualityScorer scorer = new ReasoningQualityScorer();

    private static ChainOfThoughtStep step(int number, StepType type, String content, String reasoning,
                                           double confidence) {
        return ChainOfThoughtStep.builder()
                .stepNumber(number)
                .type(type)
                .label(type.name().toLowerCase())
                .content(content)
                .reasoning(reasoning)
                .confidence(confidence)
                .build();
    }

    private static ReasoningChain chainOf(ChainOfThoughtStep... steps) {
        ReasoningChain chain = ReasoningChain.builder().id("c1").pattern(ReasoningPattern.REACT.name()).build();
        for (ChainOfThoughtStep step : steps) {
            chain.append(step);
        }
        return chain;
    }

    private static ReasoningChain observeThinkActChain(double confidenceShift) {
        return chainOf(
                step(1, StepType.OBSERVATION, "Wallet holds 2 ETH", "Read from the balance endpoint", 0.5 + confidenceShift),
                step(2, StepType.THOUGHT, "Transfer of 1 ETH fits", "Based on step 1 the balance covers it", 0.6 + confidenceShift),
                step(3, StepType.ACTION, "Submit transfer", "Therefore submit the transfer now", 0.55 + confidenceShift),
                step(4, StepType.REFLECTION, "Transfer submitted", "Following step 3 the hash is recorded", 0.7 + confidenceShift));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.05, 0.1, 0.2, 0.3})
    void shouldNotLowerScoreWhenEveryConfidenceRisesTogether(double delta) {
        // Given
        double baseline = scorer.score(observeThinkActChain(0.0));

        // When
        double raised = scorer.score(observeThinkActChain(delta));

        // Then
        assertThat(raised).isGreaterThan(baseline);
        assertThat(scorer.components(observeThinkActChain(delta)).get(ReasoningQualityScorer.TREND))
                .isCloseTo(scorer.components(observeThinkActChain(0.0)).get(ReasoningQualityScorer.TREND), within(1e-9));
    }

    @Test
    void shouldRewardThreeDistinctStepTypes() {
        List<ChainOfThoughtStep> single = List.of(step(1, StepType.THOUGHT, "a", "b", 0.8));
        List<ChainOfThoughtStep> varied = List.of(
                step(1, StepType.OBSERVATION, "a", "b", 0.8),
                step(2, StepType.THOUGHT, "a", "b", 0.8),
                step(3, StepType.ACTION, "a", "b", 0.8));

        assertThat(scorer.diversity(single)).isEqualTo(0.25);
        assertThat(scorer.diversity(varied)).isEqualTo(1.0);
    }

    @Test
    void shouldMapConfidenceSlopeAroundNeutral() {
        List<ChainOfThoughtStep> flat = List.of(
                step(1, StepType.THOUGHT, "a", "b", 0.7),
                step(2, StepType.THOUGHT, "a", "b", 0.7));
        List<ChainOfThoughtStep> rising = List.of(
                step(1, StepType.THOUGHT, "a", "b", 0.5),
                step(2, StepType.THOUGHT, "a", "b", 0.6),
                step(3, StepType.THOUGHT, "a", "b", 0.7));
        List<ChainOfThoughtStep> falling = List.of(
                step(1, StepType.THOUGHT, "a", "b", 0.9),
                step(2, StepType.THOUGHT, "a", "b", 0.5));

        assertThat(scorer.trend(flat)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.trend(rising)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.trend(falling)).isZero();
        assertThat(scorer.trend(List.of(step(1, StepType.THOUGHT, "a", "b", 0.1)))).isEqualTo(0.5);
    }

    @Test
    void shouldScaleDepthByReasoningLength() {
        List<ChainOfThoughtStep> steps = List.of(step(1, StepType.THOUGHT, "a", "x".repeat(60), 0.8));

        assertThat(scorer.depth(steps)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.depth(List.of(step(1, StepType.THOUGHT, "a", "x".repeat(500), 0.8)))).isEqualTo(1.0);
    }

    @Test
    void shouldMeasureFlowFromThirdStepOn() {
        // Given
        ChainOfThoughtStep first = step(1, StepType.OBSERVATION, "Wallet balance fetched", "first", 0.8);
        ChainOfThoughtStep second = step(2, StepType.THOUGHT, "Unrelated idea", "second", 0.8);
        ChainOfThoughtStep referencing = step(3, StepType.ACTION, "Prepare the transfer", "Using step 2 we act", 0.8);
        ChainOfThoughtStep connective = step(4, StepType.ACTION, "Act", "Therefore we act", 0.8);
        ChainOfThoughtStep sharedWord = step(4, StepType.ACTION, "Transfer submitted", "we act", 0.8);
        ChainOfThoughtStep disconnected = step(3, StepType.ACTION, "Go", "we act", 0.8);

        // Then
        assertThat(scorer.flow(List.of(first, second))).isEqualTo(1.0);
        assertThat(scorer.flow(List.of(first, second, referencing, connective))).isEqualTo(1.0);
        assertThat(scorer.flow(List.of(first, second, referencing, sharedWord))).isEqualTo(1.0);
        assertThat(scorer.flow(List.of(first, second, disconnected))).isZero();
    }

    @Test
    void shouldScoreCoherentChainAboveIncoherentOne() {
        // Given
        ReasoningChain coherent = chainOf(
                step(1, StepType.OBSERVATION, "The wallet holds 10 tokens", "Balance read from the chain", 0.8),
                step(2, StepType.THOUGHT, "Transfer of 5 tokens is affordable", "Building on step 1, funds suffice", 0.85),
                step(3, StepType.ACTION, "Submit the transfer", "Therefore the transfer can go ahead", 0.9),
                step(4, StepType.REFLECTION, "The transfer landed", "Based on the receipt, the conclusion holds", 0.95));
        ReasoningChain incoherent = chainOf(
                step(1, StepType.THOUGHT, "x", "", 0.6),
                step(2, StepType.THOUGHT, "y", "", 0.4),
                step(3, StepType.THOUGHT, "z", "", 0.2));

        // When
        double high = scorer.score(coherent);
        double low = scorer.score(incoherent);

        // Then
        assertThat(high).isBetween(0.0, 1.0).isGreaterThan(low);
        assertThat(low).isBetween(0.0, 1.0);
    }

    @Test
    void shouldFlagWeakChainsForReview() {
        // Given
        ReasoningChain weak = chainOf(
                step(1, StepType.THOUGHT, "x", "", 0.3),
                step(2, StepType.THOUGHT, "y", "", 0.2),
                step(3, StepType.THOUGHT, "z", "", 0.1));

        // When
        QualityAssessment assessment = scorer.assess(weak, 0.6);

        // Then
        assertThat(assessment.needsReview()).isTrue();
        assertThat(assessment.components()).containsKeys(
                ReasoningQualityScorer.DIVERSITY, ReasoningQualityScorer.TREND, ReasoningQualityScorer.CONFIDENCE,
                ReasoningQualityScorer.DEPTH, ReasoningQualityScorer.FLOW);
        assertThat(assessment.improvements()).contains("Use at least three different step types");
        assertThat(assessment.score()).isCloseTo(scorer.score(weak), within(1e-9));
    }

    @Test
    void shouldScoreEmptyChainWithoutFailing() {
        assertThat(scorer.score(chainOf())).isBetween(0.0, 1.0);
    }
}
