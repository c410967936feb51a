package com.z254.maestro.reasoning;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic breakdown of a chain's quality score.
 *
 * @param components individual component values, each in [0, 1]
 */
public record QualityAssessment(
        double score,
        Map<String, Double> components,
        List<String> strengths,
        List<String> improvements,
        boolean needsReview
) {
}
