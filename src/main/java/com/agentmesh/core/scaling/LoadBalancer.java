package com.agentmesh.core.scaling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks a caller-reported load between 0 and 1 per agent and spreads work by it.
 * Agents never reported count as idle (0.0).
 */
public class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final ConcurrentHashMap<String, Double> loads = new ConcurrentHashMap<>();

    public void reportLoad(String agentId, double load) {
        double clamped = Math.max(0.0, Math.min(1.0, load));
        loads.put(agentId, clamped);
        log.trace("Load for {} is now {}", agentId, clamped);
    }

    /** Adds {@code delta} to the agent's load atomically, clamped to [0, 1]. */
    public double adjustLoad(String agentId, double delta) {
        return loads.merge(agentId, Math.max(0.0, Math.min(1.0, delta)),
                (current, ignored) -> Math.max(0.0, Math.min(1.0, current + delta)));
    }

    public double loadOf(String agentId) {
        return loads.getOrDefault(agentId, 0.0);
    }

    public void remove(String agentId) {
        loads.remove(agentId);
    }

    public Map<String, Double> snapshot() {
        return Map.copyOf(loads);
    }

    /** Lowest load wins; ties go to the candidate listed first. */
    public Optional<String> leastLoadedAgent(Collection<String> candidates) {
        String best = null;
        double bestLoad = Double.MAX_VALUE;
        for (String candidate : candidates) {
            double load = loadOf(candidate);
            if (load < bestLoad) {
                best = candidate;
                bestLoad = load;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Assigns tasks round robin over the agents sorted by ascending load (stable for equal loads).
     * Every agent appears in the result, possibly with an empty list.
     */
    public <T> Map<String, List<T>> distributeTasks(List<T> tasks, List<String> agents) {
        var result = new LinkedHashMap<String, List<T>>();
        if (agents.isEmpty()) {
            if (!tasks.isEmpty()) {
                log.warn("No agents to distribute {} task(s) over", tasks.size());
            }
            return result;
        }
        var sorted = new ArrayList<>(agents);
        sorted.sort(Comparator.comparingDouble(this::loadOf));
        sorted.forEach(agent -> result.put(agent, new ArrayList<>()));
        for (int i = 0; i < tasks.size(); i++) {
            result.get(sorted.get(i % sorted.size())).add(tasks.get(i));
        }
        return result;
    }
}
