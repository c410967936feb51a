package com.z254.maestro.capability;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.AgentCapabilityMatch;
import com.z254.maestro.domain.model.Capability;
import com.z254.maestro.domain.model.Capability.CapabilityKey;
import com.z254.maestro.domain.model.SecurityLevel;
import com.z254.maestro.domain.model.TaskRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of worker capabilities with live performance metrics.
 * Entries are keyed by (agentId, capabilityName); callers only ever receive copies.
 */
@Service
@Slf4j
public class CapabilityCatalog {

    static final double SUCCESS_WEIGHT = 0.5;
    static final double LOAD_WEIGHT = 0.2;
    static final double LATENCY_WEIGHT = 0.2;
    static final double SECURITY_WEIGHT = 0.1;
    static final double SECURITY_SHORTFALL_FACTOR = 0.3;

    // Reference latency when a requirement sets no ceiling
    static final long UNBOUNDED_LATENCY_REFERENCE_MS = 30_000;

    private static final Comparator<AgentCapabilityMatch> RANKING =
            Comparator.comparingDouble(AgentCapabilityMatch::score).reversed()
                    .thenComparingDouble(m -> m.capability().getCurrentLoad())
                    .thenComparingDouble(m -> m.capability().getCost())
                    .thenComparing(AgentCapabilityMatch::agentId);

    private final Map<CapabilityKey, Capability> entries = new ConcurrentHashMap<>();
    private final double smoothing;

    public CapabilityCatalog(MaestroProperties properties) {
        this.smoothing = properties.getCatalog().getMetricSmoothing();
        properties.getCatalog().getSeed().forEach(this::registerCapability);
        log.info("Initialized CapabilityCatalog with {} seeded capabilities", entries.size());
    }

    /**
     * Insert or overwrite the entry for (agentId, capabilityName).
     */
    public void registerCapability(Capability capability) {
        if (capability == null || isBlank(capability.getAgentId()) || isBlank(capability.getName())) {
            throw new IllegalArgumentException("Capability requires agentId and name");
        }
        Capability entry = capability.copy();
        entry.setSuccessRate(clamp(entry.getSuccessRate()));
        entry.setCurrentLoad(clamp(entry.getCurrentLoad()));
        entry.setEstimatedLatencyMs(Math.max(0, entry.getEstimatedLatencyMs()));
        if (entry.getSecurityLevel() == null) {
            entry.setSecurityLevel(SecurityLevel.LOW);
        }
        Capability previous = entries.put(entry.key(), entry);
        if (previous == null) {
            log.info("Registered capability {} for agent {}", entry.getName(), entry.getAgentId());
        } else {
            log.debug("Updated capability {} for agent {}", entry.getName(), entry.getAgentId());
        }
    }

    public void registerCapabilities(List<Capability> capabilities) {
        capabilities.forEach(this::registerCapability);
    }

    /**
     * Remove every capability advertised by an agent.
     *
     * @return number of entries removed
     */
    public int unregisterAgent(String agentId) {
        List<CapabilityKey> keys = entries.keySet().stream()
                .filter(k -> k.agentId().equals(agentId))
                .toList();
        keys.forEach(entries::remove);
        if (!keys.isEmpty()) {
            log.info("Unregistered {} capabilities of agent {}", keys.size(), agentId);
        }
        return keys.size();
    }

    /**
     * Rank every qualifying (agent, capability) pair for a requirement, best first.
     * Candidates over the latency ceiling, or below the security floor when it is strict,
     * are excluded. Never throws; an empty list means nothing qualifies.
     */
    public List<AgentCapabilityMatch> findBestAgentsForTask(TaskRequirement requirement) {
        if (requirement == null || requirement.getCapabilities() == null
                || requirement.getCapabilities().isEmpty()) {
            return List.of();
        }
        List<AgentCapabilityMatch> matches = new ArrayList<>();
        for (Capability capability : entries.values()) {
            if (!requirement.getCapabilities().contains(capability.getName())) {
                continue;
            }
            if (capability.getEstimatedLatencyMs() > requirement.getMaxLatencyMs()) {
                continue;
            }
            boolean meetsSecurity = capability.getSecurityLevel().isAtLeast(requirement.getSecurityLevel());
            if (!meetsSecurity && requirement.isStrictSecurity()) {
                continue;
            }
            Capability snapshot = capability.copy();
            matches.add(new AgentCapabilityMatch(snapshot.getAgentId(), snapshot,
                    score(snapshot, requirement), describe(snapshot, requirement)));
        }
        matches.sort(RANKING);
        log.debug("Found {} candidates for {}", matches.size(), requirement.getCapabilities());
        return matches;
    }

    /**
     * Best candidate only.
     */
    public Optional<AgentCapabilityMatch> findBestAgent(TaskRequirement requirement) {
        List<AgentCapabilityMatch> matches = findBestAgentsForTask(requirement);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Overwrite live metrics of an entry. Null arguments leave the current value untouched.
     */
    public void updateAgentMetrics(String agentId, String capabilityName,
                                   Double successRate, Long latencyMs, Double load) {
        entries.computeIfPresent(new CapabilityKey(agentId, capabilityName), (key, entry) -> {
            if (successRate != null) entry.setSuccessRate(clamp(successRate));
            if (latencyMs != null) entry.setEstimatedLatencyMs(Math.max(0, latencyMs));
            if (load != null) entry.setCurrentLoad(clamp(load));
            return entry;
        });
    }

    /**
     * Fold one execution outcome into the moving averages of an entry.
     */
    public void recordOutcome(String agentId, String capabilityName, boolean success, Long latencyMs) {
        entries.computeIfPresent(new CapabilityKey(agentId, capabilityName), (key, entry) -> {
            double observed = success ? 1.0 : 0.0;
            entry.setSuccessRate(clamp(smoothing * observed + (1 - smoothing) * entry.getSuccessRate()));
            if (latencyMs != null && latencyMs >= 0) {
                entry.setEstimatedLatencyMs(Math.round(
                        smoothing * latencyMs + (1 - smoothing) * entry.getEstimatedLatencyMs()));
            }
            return entry;
        });
    }

    /**
     * Shift the advertised load of an entry, clamped to [0, 1].
     */
    public void adjustLoad(String agentId, String capabilityName, double delta) {
        entries.computeIfPresent(new CapabilityKey(agentId, capabilityName), (key, entry) -> {
            entry.setCurrentLoad(clamp(entry.getCurrentLoad() + delta));
            return entry;
        });
    }

    public Optional<Capability> getCapability(String agentId, String capabilityName) {
        return Optional.ofNullable(entries.get(new CapabilityKey(agentId, capabilityName)))
                .map(Capability::copy);
    }

    public List<Capability> getCapabilities() {
        return entries.values().stream()
                .map(Capability::copy)
                .sorted(Comparator.comparing(Capability::getAgentId).thenComparing(Capability::getName))
                .toList();
    }

    public List<Capability> getAgentCapabilities(String agentId) {
        return getCapabilities().stream()
                .filter(c -> c.getAgentId().equals(agentId))
                .toList();
    }

    public List<String> getAgentsWithCapability(String capabilityName) {
        return entries.keySet().stream()
                .filter(k -> k.name().equals(capabilityName))
                .map(CapabilityKey::agentId)
                .sorted()
                .toList();
    }

    public boolean hasCapability(String capabilityName) {
        return entries.keySet().stream().anyMatch(k -> k.name().equals(capabilityName));
    }

    public int size() {
        return entries.size();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    double score(Capability capability, TaskRequirement requirement) {
        double success = capability.getSuccessRate() * SUCCESS_WEIGHT;
        double load = (1.0 - capability.getCurrentLoad()) * LOAD_WEIGHT;
        double latency = (1.0 - latencyRatio(capability, requirement)) * LATENCY_WEIGHT;
        double security = capability.getSecurityLevel().isAtLeast(requirement.getSecurityLevel())
                ? SECURITY_WEIGHT
                : SECURITY_WEIGHT * SECURITY_SHORTFALL_FACTOR;
        return clamp(success + load + latency + security);
    }

    private double latencyRatio(Capability capability, TaskRequirement requirement) {
        long ceiling = requirement.getMaxLatencyMs() == Long.MAX_VALUE
                ? UNBOUNDED_LATENCY_REFERENCE_MS
                : requirement.getMaxLatencyMs();
        if (ceiling <= 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) capability.getEstimatedLatencyMs() / ceiling);
    }

    private String describe(Capability capability, TaskRequirement requirement) {
        return String.format("%s on %s: success %.0f%%, load %.0f%%, latency %dms, security %s (required %s)",
                capability.getName(), capability.getAgentId(),
                capability.getSuccessRate() * 100, capability.getCurrentLoad() * 100,
                capability.getEstimatedLatencyMs(), capability.getSecurityLevel(),
                requirement.getSecurityLevel());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
