package com.z254.maestro.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for MAESTRO.
 * Emits one JSON line per orchestration event, enriched with MDC context.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_OWNER_ID = "ownerId";
    public static final String MDC_PLAN_ID = "planId";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a task.
     */
    public void setTaskContext(String taskId, String ownerId, String agentId) {
        if (taskId != null) MDC.put(MDC_TASK_ID, taskId);
        if (ownerId != null) MDC.put(MDC_OWNER_ID, ownerId);
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
    }

    public void clearContext() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_OWNER_ID);
        MDC.remove(MDC_PLAN_ID);
    }

    public void logTaskSubmitted(String taskId, String ownerId, String priority, boolean complex) {
        logEvent("task_submitted", Map.of(
                "taskId", taskId,
                "ownerId", ownerId != null ? ownerId : "anonymous",
                "priority", priority,
                "complex", complex
        ));
    }

    public void logTaskDispatched(String taskId, String stepId, String agentId, String capability, int attempt) {
        MDC.put(MDC_AGENT_ID, agentId);
        logEvent("task_dispatched", Map.of(
                "taskId", taskId,
                "stepId", stepId,
                "agentId", agentId,
                "capability", capability,
                "attempt", attempt
        ));
        MDC.remove(MDC_AGENT_ID);
    }

    public void logTaskCompleted(String taskId, long durationMs, int steps) {
        logEvent("task_completed", Map.of(
                "taskId", taskId,
                "durationMs", durationMs,
                "steps", steps
        ));
    }

    public void logTaskFailed(String taskId, String errorCode, String errorMessage) {
        logEvent("task_failed", Map.of(
                "taskId", taskId,
                "errorCode", errorCode,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"
        ));
    }

    public void logTaskRetried(String taskId, int retryCount, int maxRetries, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("taskId", taskId);
        data.put("retryCount", retryCount);
        data.put("maxRetries", maxRetries);
        if (reason != null) data.put("reason", reason);
        logEvent("task_retried", data);
    }

    public void logSelectionFailed(String taskId, String capability) {
        logEvent("selection_failed", Map.of(
                "taskId", taskId,
                "capability", capability
        ));
    }

    public void logPlanCreated(String taskId, String planId, int steps, double confidence, boolean parallel) {
        MDC.put(MDC_PLAN_ID, planId);
        logEvent("plan_created", Map.of(
                "taskId", taskId,
                "planId", planId,
                "steps", steps,
                "confidence", confidence,
                "parallelEligible", parallel
        ));
        MDC.remove(MDC_PLAN_ID);
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "maestro");

        String ownerId = MDC.get(MDC_OWNER_ID);
        if (ownerId != null) event.putIfAbsent("ownerId", ownerId);

        String planId = MDC.get(MDC_PLAN_ID);
        if (planId != null) event.putIfAbsent("planId", planId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
