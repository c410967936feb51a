package com.z254.maestro.reasoning;

import com.z254.maestro.domain.model.ChainOfThoughtStep;
import com.z254.maestro.domain.model.ReasoningChain;
import com.z254.maestro.domain.model.StepType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores reasoning chains in [0, 1]. Purely diagnostic: a low score only tags a chain for review.
 */
@Component
public class ReasoningQualityScorer {

    public static final String DIVERSITY = "diversity";
    public static final String TREND = "trend";
    public static final String CONFIDENCE = "confidence";
    public static final String DEPTH = "depth";
    public static final String FLOW = "flow";

    static final double DIVERSITY_WEIGHT = 0.2;
    static final double TREND_WEIGHT = 0.15;
    static final double CONFIDENCE_WEIGHT = 0.3;
    static final double DEPTH_WEIGHT = 0.15;
    static final double FLOW_WEIGHT = 0.2;

    // Reasoning text length that earns full depth credit
    static final int TARGET_REASONING_LENGTH = 120;
    // Slope of -0.1 per step or worse zeroes the trend component
    static final double TREND_SENSITIVITY = 5.0;
    private static final int MIN_DISTINCT_TYPES = 3;
    private static final int FLOW_EXEMPT_STEPS = 2;
    private static final int SIGNIFICANT_WORD_LENGTH = 5;

    private static final List<String> CONNECTIVES = List.of(
            "therefore", "because", "thus", "so ", "hence", "given", "based on", "building on",
            "as a result", "consequently", "following");

    public double score(ReasoningChain chain) {
        return weigh(components(chain));
    }

    /**
     * Component values keyed by name, each in [0, 1].
     */
    public Map<String, Double> components(ReasoningChain chain) {
        List<ChainOfThoughtStep> steps = chain.getSteps();
        Map<String, Double> components = new LinkedHashMap<>();
        components.put(DIVERSITY, diversity(steps));
        components.put(TREND, trend(steps));
        components.put(CONFIDENCE, meanConfidence(steps));
        components.put(DEPTH, depth(steps));
        components.put(FLOW, flow(steps));
        return components;
    }

    public QualityAssessment assess(ReasoningChain chain, double reviewThreshold) {
        Map<String, Double> components = components(chain);
        double score = weigh(components);
        List<String> strengths = new ArrayList<>();
        List<String> improvements = new ArrayList<>();

        if (components.get(DIVERSITY) >= 1.0) {
            strengths.add("Covers observation, analysis and action");
        } else {
            improvements.add("Use at least three different step types");
        }
        if (components.get(TREND) > 0.5) {
            strengths.add("Confidence builds across the chain");
        } else if (components.get(TREND) < 0.25) {
            improvements.add("Confidence drops sharply across the chain");
        }
        if (components.get(CONFIDENCE) >= 0.8) {
            strengths.add("High overall confidence");
        } else if (components.get(CONFIDENCE) < 0.6) {
            improvements.add("Raise confidence with stronger evidence");
        }
        if (components.get(DEPTH) >= 0.8) {
            strengths.add("Detailed reasoning");
        } else {
            improvements.add("Expand the reasoning behind each step");
        }
        if (components.get(FLOW) >= 0.8) {
            strengths.add("Steps follow from one another");
        } else {
            improvements.add("Tie each step explicitly to the previous one");
        }
        return new QualityAssessment(score, components, strengths, improvements, score < reviewThreshold);
    }

    // --------------------------------------------------------------------------------------------
    // Components
    // --------------------------------------------------------------------------------------------

    double diversity(List<ChainOfThoughtStep> steps) {
        Set<StepType> types = EnumSet.noneOf(StepType.class);
        steps.forEach(s -> types.add(s.getType()));
        if (types.size() >= MIN_DISTINCT_TYPES) {
            return 1.0;
        }
        return types.size() / (double) (MIN_DISTINCT_TYPES + 1);
    }

    /**
     * Least-squares slope of confidence over step index, mapped to [0, 1] around a neutral 0.5.
     */
    double trend(List<ChainOfThoughtStep> steps) {
        int n = steps.size();
        if (n < 2) {
            return 0.5;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = steps.stream().mapToDouble(ChainOfThoughtStep::getConfidence).average().orElse(0.0);
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (steps.get(i).getConfidence() - meanY);
            denominator += dx * dx;
        }
        double slope = numerator / denominator;
        return clamp(0.5 + slope * TREND_SENSITIVITY);
    }

    double meanConfidence(List<ChainOfThoughtStep> steps) {
        return clamp(steps.stream().mapToDouble(ChainOfThoughtStep::getConfidence).average().orElse(0.0));
    }

    double depth(List<ChainOfThoughtStep> steps) {
        double meanLength = steps.stream()
                .mapToInt(s -> s.getReasoning() != null ? s.getReasoning().length() : 0)
                .average()
                .orElse(0.0);
        return Math.min(1.0, meanLength / TARGET_REASONING_LENGTH);
    }

    /**
     * Share of steps, after the first two, that reference or follow from the step before them.
     */
    double flow(List<ChainOfThoughtStep> steps) {
        int eligible = 0;
        int connected = 0;
        for (int i = FLOW_EXEMPT_STEPS; i < steps.size(); i++) {
            eligible++;
            if (followsFrom(steps.get(i), steps.get(i - 1))) {
                connected++;
            }
        }
        return eligible == 0 ? 1.0 : (double) connected / eligible;
    }

    private boolean followsFrom(ChainOfThoughtStep step, ChainOfThoughtStep previous) {
        String text = (nullToEmpty(step.getReasoning()) + " " + nullToEmpty(step.getContent()))
                .toLowerCase(Locale.ROOT);
        if (text.contains("step " + previous.getStepNumber())) {
            return true;
        }
        String reasoning = nullToEmpty(step.getReasoning()).toLowerCase(Locale.ROOT).trim();
        if (CONNECTIVES.stream().anyMatch(reasoning::startsWith)) {
            return true;
        }
        Set<String> previousWords = significantWords(previous.getContent());
        return significantWords(step.getContent()).stream().anyMatch(previousWords::contains);
    }

    private static Set<String> significantWords(String text) {
        if (text == null) {
            return new HashSet<>();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> w.length() >= SIGNIFICANT_WORD_LENGTH)
                .collect(Collectors.toSet());
    }

    private double weigh(Map<String, Double> components) {
        return clamp(components.get(DIVERSITY) * DIVERSITY_WEIGHT
                + components.get(TREND) * TREND_WEIGHT
                + components.get(CONFIDENCE) * CONFIDENCE_WEIGHT
                + components.get(DEPTH) * DEPTH_WEIGHT
                + components.get(FLOW) * FLOW_WEIGHT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
