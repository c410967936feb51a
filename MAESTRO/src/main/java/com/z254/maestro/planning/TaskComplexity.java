package com.z254.maestro.planning;

import com.z254.maestro.domain.model.Task;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies tasks as simple or complex.
 */
public final class TaskComplexity {

    private static final Pattern SEQUENCING = Pattern.compile(
            "\\b(then|afterwards|after that|followed by|once (that|it) is done|and finally|step by step|"
                    + "first\\b.+\\bnext)\\b",
            Pattern.CASE_INSENSITIVE);

    private TaskComplexity() {
    }

    /**
     * True when the description asks for steps in a particular order.
     */
    public static boolean hasSequencingLanguage(String description) {
        return description != null && SEQUENCING.matcher(description).find();
    }

    /**
     * Complex tasks need more than one capability or spell out an order of steps.
     */
    public static boolean isComplex(Task task) {
        List<String> capabilities = task.getRequiredCapabilities();
        int distinct = capabilities == null ? 0 : new LinkedHashSet<>(capabilities).size();
        return distinct > 1 || hasSequencingLanguage(task.getDescription());
    }
}
