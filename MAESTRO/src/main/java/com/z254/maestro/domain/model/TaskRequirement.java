package com.z254.maestro.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Selection criteria handed to the capability catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequirement {

    /**
     * Capability names any of which qualifies a candidate.
     */
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    @Builder.Default
    private SecurityLevel securityLevel = SecurityLevel.LOW;

    /**
     * Upper bound on a candidate's estimated latency, in milliseconds.
     */
    @Builder.Default
    private long maxLatencyMs = Long.MAX_VALUE;

    /**
     * When true, candidates below the security floor are excluded instead of penalized.
     */
    @Builder.Default
    private boolean strictSecurity = true;

    public static TaskRequirement of(String capability, SecurityLevel securityLevel, long maxLatencyMs) {
        return TaskRequirement.builder()
                .capabilities(new ArrayList<>(List.of(capability)))
                .securityLevel(securityLevel)
                .maxLatencyMs(maxLatencyMs)
                .build();
    }
}
