package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.TaskPriority;

import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristics for requests that leave priority or category unset.
 */
final class TaskInference {

    static final String DEFAULT_CATEGORY = "general";

    private static final List<String> HIGH_PRIORITY = List.of("urgent", "asap", "immediately", "balance", "check");
    private static final List<String> MEDIUM_PRIORITY = List.of("transfer", "send", "nft", "mint", "swap");

    private TaskInference() {
    }

    static TaskPriority inferPriority(String description) {
        String text = lower(description);
        if (HIGH_PRIORITY.stream().anyMatch(text::contains)) {
            return TaskPriority.HIGH;
        }
        if (MEDIUM_PRIORITY.stream().anyMatch(text::contains)) {
            return TaskPriority.MEDIUM;
        }
        return TaskPriority.LOW;
    }

    static String inferCategory(String description) {
        String text = lower(description);
        if (text.contains("deploy") && text.contains("contract")) {
            return "contract_deployment";
        }
        if (text.contains("nft") || text.contains("mint")) {
            return "nft_operations";
        }
        if (text.contains("balance")) {
            return "balance_check";
        }
        if (text.contains("transfer") || text.contains("send") || text.contains("token")) {
            return "token_operations";
        }
        if (text.contains("swap") || text.contains("stake") || text.contains("liquidity")) {
            return "defi_operations";
        }
        if (text.contains("schedule") || text.contains("automate")) {
            return "automation";
        }
        if (text.contains("what") || text.contains("explain") || text.contains("info")) {
            return "information";
        }
        return DEFAULT_CATEGORY;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
