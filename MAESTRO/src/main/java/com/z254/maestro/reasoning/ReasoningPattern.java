package com.z254.maestro.reasoning;

import com.z254.maestro.domain.model.StepType;

import java.util.List;

/**
 * Fixed library of reasoning patterns. Each pattern is an ordered list of step templates;
 * {@code %s} in a template is replaced by the chain's subject.
 */
public enum ReasoningPattern {

    /**
     * Observe, think, act, reflect.
     */
    REACT(List.of(
            new Template("observe", StepType.OBSERVATION,
                    "Observe the current state of %s and collect the facts that matter."),
            new Template("think", StepType.THOUGHT,
                    "Think through how those facts about %s shape the approach."),
            new Template("act", StepType.ACTION,
                    "Act on %s using the approach chosen from the facts."),
            new Template("reflect", StepType.REFLECTION,
                    "Reflect on the outcome for %s and draw a conclusion.")
    )),

    /**
     * Situation, options, long-term impact, decision, validation.
     */
    STRATEGIC(List.of(
            new Template("situation", StepType.OBSERVATION,
                    "Assess the situation around %s, its constraints and the resources at hand."),
            new Template("options", StepType.THOUGHT,
                    "Enumerate the options available for %s given that situation."),
            new Template("long-term-impact", StepType.THOUGHT,
                    "Weigh the long-term impact of each option for %s."),
            new Template("decision", StepType.ACTION,
                    "Decide on the option for %s with the best long-term impact."),
            new Template("validation", StepType.REFLECTION,
                    "Validate the decision for %s against the original situation and state a conclusion.")
    )),

    /**
     * Evidence, hypothesis, test, interpret, critique.
     */
    ANALYTICAL(List.of(
            new Template("evidence", StepType.OBSERVATION,
                    "Gather the evidence available about %s."),
            new Template("hypothesis", StepType.THOUGHT,
                    "Form a hypothesis about %s that explains the evidence."),
            new Template("test", StepType.ACTION,
                    "Test the hypothesis about %s against the evidence."),
            new Template("interpret", StepType.THOUGHT,
                    "Interpret what the test says about the hypothesis for %s."),
            new Template("critique", StepType.REFLECTION,
                    "Critique the interpretation for %s, note its weak points and state a conclusion.")
    )),

    /**
     * Claim inventory, logic check, evidence check, recommend, score.
     */
    VALIDATION(List.of(
            new Template("claim-inventory", StepType.OBSERVATION,
                    "List every claim made about %s."),
            new Template("logic-check", StepType.THOUGHT,
                    "Check the logic connecting the claims about %s."),
            new Template("evidence-check", StepType.THOUGHT,
                    "Check that each claim about %s is backed by evidence."),
            new Template("recommend", StepType.ACTION,
                    "Recommend corrections for the unsupported claims about %s."),
            new Template("score", StepType.REFLECTION,
                    "Score the overall soundness of the reasoning about %s and state a conclusion.")
    ));

    private final List<Template> templates;

    ReasoningPattern(List<Template> templates) {
        this.templates = templates;
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public int length() {
        return templates.size();
    }

    public Template templateAt(int index) {
        return templates.get(index % templates.size());
    }

    /**
     * One step of a pattern.
     */
    public record Template(String label, StepType type, String text) {

        public String render(String subject) {
            return String.format(text, subject);
        }
    }
}
