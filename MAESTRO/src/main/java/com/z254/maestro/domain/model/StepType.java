package com.z254.maestro.domain.model;

/**
 * Kind of a chain-of-thought step.
 */
public enum StepType {

    /**
     * Facts gathered about the situation.
     */
    OBSERVATION,

    /**
     * Interpretation or hypothesis.
     */
    THOUGHT,

    /**
     * Decision or concrete step taken.
     */
    ACTION,

    /**
     * Review of what was done.
     */
    REFLECTION
}
