package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single step of a reasoning chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainOfThoughtStep {

    /**
     * 1-based position in the chain.
     */
    private int stepNumber;

    private StepType type;

    /**
     * Label of the pattern template that produced the step, e.g. {@code situation}.
     */
    private String label;

    private String content;

    private String reasoning;

    /**
     * Confidence (0.0 - 1.0).
     */
    private double confidence;

    private Instant timestamp;

    private String agentId;
}
