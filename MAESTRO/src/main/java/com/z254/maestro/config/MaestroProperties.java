package com.z254.maestro.config;

import com.z254.maestro.domain.model.Capability;
import com.z254.maestro.domain.model.TaskPriority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the MAESTRO orchestration core.
 */
@Data
@Component
@ConfigurationProperties(prefix = "maestro")
public class MaestroProperties {

    private SchedulingProperties scheduling = new SchedulingProperties();
    private TaskProperties tasks = new TaskProperties();
    private LatencyProperties latency = new LatencyProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private BusProperties bus = new BusProperties();
    private RoutingProperties routing = new RoutingProperties();
    private PlanningProperties planning = new PlanningProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();

    @Data
    public static class SchedulingProperties {
        private boolean enabled = true;
        private int maxConcurrentTasks = 5;
        private Duration tickInterval = Duration.ofSeconds(1);
        private boolean watchdogEnabled = true;
        /**
         * Multiple of the latency ceiling a dispatch may run before the watchdog fails it.
         */
        private double watchdogGraceFactor = 2.0;
        private Duration estimatedStartPerPosition = Duration.ofMinutes(3);
    }

    @Data
    public static class TaskProperties {
        private int maxRetries = 3;
        private Duration archiveGracePeriod = Duration.ofMinutes(5);
        private int historyLimit = 1000;
        private int historyTrimTo = 500;
        private Duration defaultDuration = Duration.ofMinutes(5);
        private Map<String, Duration> categoryDurations = new HashMap<>(Map.of(
                "contract_deployment", Duration.ofMinutes(8),
                "nft_operations", Duration.ofMinutes(3),
                "token_operations", Duration.ofMinutes(2),
                "defi_operations", Duration.ofMinutes(5),
                "information", Duration.ofMinutes(1),
                "automation", Duration.ofMinutes(3)
        ));
    }

    @Data
    public static class LatencyProperties {
        private Duration high = Duration.ofSeconds(5);
        private Duration medium = Duration.ofSeconds(15);
        private Duration low = Duration.ofSeconds(30);

        public Duration forPriority(TaskPriority priority) {
            return switch (priority) {
                case HIGH -> high;
                case MEDIUM -> medium;
                case LOW -> low;
            };
        }
    }

    @Data
    public static class CatalogProperties {
        /**
         * Smoothing factor of the success-rate and latency moving averages.
         */
        private double metricSmoothing = 0.1;
        private double loadIncrement = 0.1;
        private List<Capability> seed = new ArrayList<>();
    }

    @Data
    public static class BusProperties {
        private int historyLimit = 1000;
    }

    @Data
    public static class RoutingProperties {
        /**
         * Capabilities required by a category when the request names none.
         */
        private Map<String, List<String>> categoryCapabilities = new HashMap<>();
        /**
         * Dispatch topic per capability; anything unlisted goes out as {@code execute_task}.
         */
        private Map<String, String> messageTypes = new HashMap<>();
    }

    @Data
    public static class PlanningProperties {
        private String validatorCapability = "validation";
    }

    @Data
    public static class ReasoningProperties {
        private int maxCycles = 1;
        private double reviewThreshold = 0.6;
        private int historyLimit = 200;
        private double baseConfidence = 0.75;
    }
}
