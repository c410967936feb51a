package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only sequence of reasoning steps for one session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningChain {

    private String id;
    private String agentId;
    private String agentRole;

    /**
     * Name of the pattern driving the chain.
     */
    private String pattern;

    /**
     * What the chain reasons about.
     */
    private String subject;

    @Builder.Default
    private List<ChainOfThoughtStep> steps = new ArrayList<>();

    private boolean finalized;

    /**
     * Quality score, set on finalization.
     */
    private Double qualityScore;

    private boolean needsReview;

    private Instant startedAt;
    private Instant finalizedAt;

    public void append(ChainOfThoughtStep step) {
        if (finalized) {
            throw new IllegalStateException("Chain " + id + " is finalized");
        }
        steps.add(step);
    }

    public List<ChainOfThoughtStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }

    public ChainOfThoughtStep lastStep() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }
}
