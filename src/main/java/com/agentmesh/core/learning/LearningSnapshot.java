package com.agentmesh.core.learning;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy of an engine's learned tables, keyed by state key then action.
 *
 * @param engine    engine type, e.g. {@code q-learning}
 * @param tables    Q-values or action probabilities per state
 * @param baselines per-state value baselines (empty for Q-learning)
 */
public record LearningSnapshot(
    String engine,
    Map<String, Map<String, Double>> tables,
    Map<String, Double> baselines
) {

    public LearningSnapshot {
        tables = deepCopy(tables);
        baselines = baselines != null ? Map.copyOf(baselines) : Map.of();
    }

    static Map<String, Map<String, Double>> deepCopy(Map<String, ? extends Map<String, Double>> source) {
        var copy = new HashMap<String, Map<String, Double>>();
        if (source != null) {
            source.forEach((state, actions) ->
                    copy.put(state, Collections.unmodifiableMap(new LinkedHashMap<>(actions))));
        }
        return Collections.unmodifiableMap(copy);
    }
}
