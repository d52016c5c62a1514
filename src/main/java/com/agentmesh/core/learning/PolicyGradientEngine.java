package com.agentmesh.core.learning;

import com.agentmesh.config.AgentMeshProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Per-state action distributions with a per-state value baseline, updated once per episode.
 * <p>
 * At episode end each recorded step gets its discounted return {@code G}. With
 * {@code advantage = G - baseline}, the baseline moves by {@code valueRate * (G - baseline)} and
 * the chosen action's probability by {@code alpha * advantage * (1 - p)}. Probabilities are then
 * floored at {@value #MIN_PROBABILITY} and renormalized, so no action ever becomes impossible.
 */
public class PolicyGradientEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyGradientEngine.class);

    public static final String ENGINE = "policy-gradient";
    static final double MIN_PROBABILITY = 0.01;

    private record Step(String stateKey, String action, double reward) {}

    private final double learningRate;
    private final double discountFactor;
    private final double valueLearningRate;
    private final Random random;

    private final Map<String, Map<String, Double>> policies = new HashMap<>();
    private final Map<String, Double> baselines = new HashMap<>();
    private final List<Step> episode = new ArrayList<>();

    public PolicyGradientEngine(AgentMeshProperties.PolicyGradient settings, Random random) {
        this.learningRate = settings.getLearningRate();
        this.discountFactor = settings.getDiscountFactor();
        this.valueLearningRate = settings.getValueLearningRate();
        this.random = random != null ? random : new Random();
    }

    /**
     * Samples one of {@code actions} from the state's distribution. A state seen for the first
     * time starts uniform; actions new to a known state join at the uniform share.
     */
    public synchronized String selectAction(Map<String, ?> state, List<String> actions) {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("No actions to choose from");
        }
        Map<String, Double> policy = policyFor(StateKeys.of(state), actions);
        double total = 0;
        for (String action : actions) {
            total += policy.get(action);
        }
        double draw = random.nextDouble() * total;
        double cumulative = 0;
        for (String action : actions) {
            cumulative += policy.get(action);
            if (draw < cumulative) {
                return action;
            }
        }
        return actions.get(actions.size() - 1);
    }

    private Map<String, Double> policyFor(String stateKey, List<String> actions) {
        Map<String, Double> policy = policies.computeIfAbsent(stateKey, k -> new LinkedHashMap<>());
        boolean added = false;
        for (String action : actions) {
            if (!policy.containsKey(action)) {
                policy.put(action, 1.0 / Math.max(actions.size(), policy.size() + 1));
                added = true;
            }
        }
        if (added) {
            normalize(policy);
        }
        return policy;
    }

    public synchronized void recordStep(Map<String, ?> state, String action, double reward) {
        episode.add(new Step(StateKeys.of(state), action, reward));
    }

    /**
     * Applies the policy update for every step recorded since the last episode end.
     *
     * @return number of steps applied
     */
    public synchronized int endEpisode() {
        int steps = episode.size();
        double[] returns = new double[steps];
        double g = 0;
        for (int i = steps - 1; i >= 0; i--) {
            g = episode.get(i).reward() + discountFactor * g;
            returns[i] = g;
        }
        for (int i = 0; i < steps; i++) {
            Step step = episode.get(i);
            double baseline = baselines.getOrDefault(step.stateKey(), 0.0);
            double advantage = returns[i] - baseline;
            baselines.put(step.stateKey(), baseline + valueLearningRate * (returns[i] - baseline));
            nudge(step.stateKey(), step.action(), learningRate * advantage);
        }
        episode.clear();
        log.trace("Policy episode ended after {} step(s)", steps);
        return steps;
    }

    /**
     * Moves the action's probability by a human preference, the same way an advantage would.
     *
     * @return false when the state has no distribution yet
     */
    public synchronized boolean applyPreference(Map<String, ?> state, String action, double preference) {
        String stateKey = StateKeys.of(state);
        if (!policies.containsKey(stateKey)) {
            log.debug("No policy for state {} yet, preference ignored", stateKey);
            return false;
        }
        nudge(stateKey, action, learningRate * preference);
        return true;
    }

    private void nudge(String stateKey, String action, double step) {
        Map<String, Double> policy = policyFor(stateKey, List.of(action));
        double p = policy.get(action);
        policy.put(action, p + step * (1.0 - p));
        normalize(policy);
    }

    private static void normalize(Map<String, Double> policy) {
        policy.replaceAll((a, p) -> Math.max(MIN_PROBABILITY, p));
        double total = policy.values().stream().mapToDouble(Double::doubleValue).sum();
        policy.replaceAll((a, p) -> p / total);
    }

    public synchronized Map<String, Double> probabilities(Map<String, ?> state) {
        Map<String, Double> policy = policies.get(StateKeys.of(state));
        return policy != null ? Map.copyOf(policy) : Map.of();
    }

    public synchronized double baseline(Map<String, ?> state) {
        return baselines.getOrDefault(StateKeys.of(state), 0.0);
    }

    public synchronized int pendingSteps() {
        return episode.size();
    }

    public synchronized LearningSnapshot snapshot() {
        return new LearningSnapshot(ENGINE, policies, baselines);
    }

    public synchronized void restore(LearningSnapshot snapshot) {
        if (!ENGINE.equals(snapshot.engine())) {
            throw new LearningStoreException("Cannot restore " + snapshot.engine() + " tables into " + ENGINE);
        }
        policies.clear();
        baselines.clear();
        snapshot.tables().forEach((state, values) -> policies.put(state, new LinkedHashMap<>(values)));
        baselines.putAll(snapshot.baselines());
        episode.clear();
        log.info("Restored policy with {} states", policies.size());
    }
}
