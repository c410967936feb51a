package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incoming work request. Fields left null are inferred by the orchestrator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    /**
     * Optional caller-chosen id; generated when absent.
     */
    private String taskId;

    private String ownerId;

    private String description;

    /**
     * Inferred from the description when absent.
     */
    private String category;

    /**
     * Inferred from the description when absent.
     */
    private TaskPriority priority;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    /**
     * Derived from the category when empty.
     */
    @Builder.Default
    private List<String> requiredCapabilities = new ArrayList<>();

    private SecurityLevel securityLevel;

    /**
     * Falls back to the configured default when absent.
     */
    private Integer maxRetries;
}
