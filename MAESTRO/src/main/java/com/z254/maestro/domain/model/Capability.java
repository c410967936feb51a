package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One advertised skill of one worker, with the live metrics used for ranking.
 * Identity is the (agentId, name) pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Capability {

    /**
     * Worker advertising the capability.
     */
    private String agentId;

    /**
     * Capability name, e.g. {@code balance_check}.
     */
    private String name;

    private String description;

    @Builder.Default
    private SecurityLevel securityLevel = SecurityLevel.LOW;

    /**
     * Expected execution latency in milliseconds.
     */
    @Builder.Default
    private long estimatedLatencyMs = 1000;

    /**
     * Observed success rate (0.0 - 1.0).
     */
    @Builder.Default
    private double successRate = 1.0;

    /**
     * Current load (0.0 - 1.0).
     */
    @Builder.Default
    private double currentLoad = 0.0;

    /**
     * Relative cost unit, lower is cheaper.
     */
    @Builder.Default
    private double cost = 0.5;

    /**
     * Names of capabilities that must run before this one within a plan.
     */
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    public CapabilityKey key() {
        return new CapabilityKey(agentId, name);
    }

    public Capability copy() {
        return toBuilder()
                .dependencies(dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>())
                .build();
    }

    /**
     * Composite identity of a catalog entry.
     */
    public record CapabilityKey(String agentId, String name) {
    }
}
