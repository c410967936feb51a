package com.z254.maestro.reasoning;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.ChainOfThoughtStep;
import com.z254.maestro.domain.model.ReasoningChain;
import com.z254.maestro.domain.model.StepType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Produces structured reasoning chains from a fixed pattern library and scores them.
 */
@Service
@Slf4j
public class ReasoningEngine {

    public static final String CONTEXT_CONTENT = "content";
    public static final String CONTEXT_REASONING = "reasoning";
    public static final String CONTEXT_CONFIDENCE = "confidence";

    static final int MAX_CHAIN_LENGTH = 10;
    static final int MIN_CHAIN_LENGTH = 3;
    static final double CONTINUE_BELOW_CONFIDENCE = 0.7;
    private static final double CONFIDENCE_STEP = 0.03;
    private static final double MAX_GENERATED_CONFIDENCE = 0.95;

    private final ReasoningQualityScorer scorer;
    private final Scheduler loop;
    private final MaestroProperties.ReasoningProperties config;
    private final Deque<ReasoningChain> history = new ArrayDeque<>();

    public ReasoningEngine(ReasoningQualityScorer scorer, Scheduler orchestrationLoop, MaestroProperties properties) {
        this.scorer = scorer;
        this.loop = orchestrationLoop;
        this.config = properties.getReasoning();
    }

    /**
     * Pick a pattern from the agent's role and declared reasoning style, defaulting to ReAct.
     */
    public ReasoningPattern selectPattern(String agentRole, String reasoningStyle) {
        String role = agentRole != null ? agentRole.toLowerCase(Locale.ROOT) : "";
        String style = reasoningStyle != null ? reasoningStyle.toLowerCase(Locale.ROOT).trim() : "";

        if (role.contains("validator") || style.equals("validation")) {
            return ReasoningPattern.VALIDATION;
        }
        switch (style) {
            case "strategic":
                return ReasoningPattern.STRATEGIC;
            case "analytical":
                return ReasoningPattern.ANALYTICAL;
            case "react":
            case "reactive":
                return ReasoningPattern.REACT;
            default:
                break;
        }
        if (role.contains("strateg") || role.contains("planner") || role.contains("coordinator")) {
            return ReasoningPattern.STRATEGIC;
        }
        if (role.contains("analyst") || role.contains("research")) {
            return ReasoningPattern.ANALYTICAL;
        }
        return ReasoningPattern.REACT;
    }

    public ReasoningChain startChain(String agentId, String agentRole, String reasoningStyle, String subject) {
        ReasoningPattern pattern = selectPattern(agentRole, reasoningStyle);
        ReasoningChain chain = ReasoningChain.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .agentRole(agentRole)
                .pattern(pattern.name())
                .subject(subject != null ? subject : "the task")
                .startedAt(now())
                .build();
        log.debug("Started {} chain {} for agent {}", pattern, chain.getId(), agentId);
        return chain;
    }

    /**
     * Append the next template step of the chain's pattern.
     * Context entries {@code content}, {@code reasoning} and {@code confidence} override the generated values.
     *
     * @return the new step, or null once the pattern is exhausted
     */
    public ChainOfThoughtStep generateNextStep(ReasoningChain chain, Map<String, Object> context) {
        ReasoningPattern pattern = ReasoningPattern.valueOf(chain.getPattern());
        int index = chain.size();
        if (index >= pattern.length() * Math.max(1, config.getMaxCycles())) {
            return null;
        }
        ReasoningPattern.Template template = pattern.templateAt(index);
        ChainOfThoughtStep previous = chain.lastStep();

        String content = stringOr(context, CONTEXT_CONTENT, template.render(chain.getSubject()));
        String reasoning = stringOr(context, CONTEXT_REASONING, defaultReasoning(template, previous));
        double confidence = confidenceOr(context,
                Math.min(MAX_GENERATED_CONFIDENCE, config.getBaseConfidence() + CONFIDENCE_STEP * index));

        ChainOfThoughtStep step = ChainOfThoughtStep.builder()
                .stepNumber(index + 1)
                .type(template.type())
                .label(template.label())
                .content(content)
                .reasoning(reasoning)
                .confidence(confidence)
                .timestamp(now())
                .agentId(chain.getAgentId())
                .build();
        chain.append(step);
        return step;
    }

    public double scoreChain(ReasoningChain chain) {
        return scorer.score(chain);
    }

    public QualityAssessment assessQuality(ReasoningChain chain) {
        return scorer.assess(chain, config.getReviewThreshold());
    }

    /**
     * Whether the chain should keep going.
     */
    public boolean shouldContinue(ReasoningChain chain) {
        List<ChainOfThoughtStep> steps = chain.getSteps();
        if (steps.size() >= MAX_CHAIN_LENGTH) {
            return false;
        }
        ChainOfThoughtStep last = chain.lastStep();
        if (last != null && last.getType() == StepType.REFLECTION
                && last.getContent() != null
                && last.getContent().toLowerCase(Locale.ROOT).contains("conclusion")) {
            return false;
        }
        if (steps.size() < MIN_CHAIN_LENGTH) {
            return true;
        }
        double recentConfidence = steps.subList(steps.size() - MIN_CHAIN_LENGTH, steps.size()).stream()
                .mapToDouble(ChainOfThoughtStep::getConfidence)
                .average()
                .orElse(0.0);
        if (recentConfidence < CONTINUE_BELOW_CONFIDENCE) {
            return true;
        }
        ReasoningPattern pattern = ReasoningPattern.valueOf(chain.getPattern());
        return steps.size() < pattern.length() * Math.max(1, config.getMaxCycles());
    }

    /**
     * Score the chain, flag it for review when weak, and move it to history.
     */
    public QualityAssessment finalizeChain(ReasoningChain chain) {
        QualityAssessment assessment = assessQuality(chain);
        chain.setQualityScore(assessment.score());
        chain.setNeedsReview(assessment.needsReview());
        chain.setFinalized(true);
        chain.setFinalizedAt(now());
        synchronized (history) {
            history.addLast(chain);
            while (history.size() > config.getHistoryLimit()) {
                history.removeFirst();
            }
        }
        if (assessment.needsReview()) {
            log.info("Reasoning chain {} flagged for review (score {})",
                    chain.getId(), String.format("%.2f", assessment.score()));
        }
        return assessment;
    }

    /**
     * Run a full chain for a subject and finalize it.
     */
    public ReasoningChain reason(String agentId, String agentRole, String reasoningStyle,
                                 String subject, Map<String, Object> context) {
        ReasoningChain chain = startChain(agentId, agentRole, reasoningStyle, subject);
        ChainOfThoughtStep step = generateNextStep(chain, context);
        while (step != null) {
            step = generateNextStep(chain, context);
        }
        finalizeChain(chain);
        return chain;
    }

    /**
     * Most recently finalized chains, oldest first.
     */
    public List<ReasoningChain> getHistory(int limit) {
        synchronized (history) {
            List<ReasoningChain> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private String defaultReasoning(ReasoningPattern.Template template, ChainOfThoughtStep previous) {
        if (previous == null) {
            return "Starting point (" + template.label() + "): establish what is known before drawing on it.";
        }
        return "Building on step " + previous.getStepNumber() + " (" + previous.getLabel() + "), the "
                + template.label() + " step carries its findings forward.";
    }

    private Instant now() {
        return Instant.ofEpochMilli(loop.now(TimeUnit.MILLISECONDS));
    }

    private static String stringOr(Map<String, Object> context, String key, String fallback) {
        if (context == null) {
            return fallback;
        }
        Object value = context.get(key);
        return value != null ? value.toString() : fallback;
    }

    private static double confidenceOr(Map<String, Object> context, double fallback) {
        if (context != null && context.get(CONTEXT_CONFIDENCE) instanceof Number number) {
            return Math.max(0.0, Math.min(1.0, number.doubleValue()));
        }
        return fallback;
    }
}
