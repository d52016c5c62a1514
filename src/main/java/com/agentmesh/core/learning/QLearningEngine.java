package com.agentmesh.core.learning;

import com.agentmesh.config.AgentMeshProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Tabular Q-learning with epsilon-greedy selection and an optional replay buffer.
 * <p>
 * {@code Q(s,a) += alpha * (r + gamma * max Q(s',a') - Q(s,a))}, where the max over the next
 * state is 0 for terminal transitions and for states never seen. Unvisited pairs read as 0.
 * All methods are synchronized; one engine normally belongs to one agent.
 */
public class QLearningEngine {

    private static final Logger log = LoggerFactory.getLogger(QLearningEngine.class);

    public static final String ENGINE = "q-learning";

    private final double learningRate;
    private final double discountFactor;
    private final double explorationDecay;
    private final double minExplorationRate;
    private final int replayCapacity;
    private final Random random;

    private final Map<String, Map<String, Double>> table = new HashMap<>();
    private final ArrayDeque<Experience> replayBuffer = new ArrayDeque<>();
    private double explorationRate;
    private int episodes;

    public QLearningEngine(AgentMeshProperties.QLearning settings, Random random) {
        this.learningRate = settings.getLearningRate();
        this.discountFactor = settings.getDiscountFactor();
        this.explorationRate = settings.getExplorationRate();
        this.explorationDecay = settings.getExplorationDecay();
        this.minExplorationRate = settings.getMinExplorationRate();
        this.replayCapacity = Math.max(0, settings.getReplayCapacity());
        this.random = random != null ? random : new Random();
    }

    /**
     * Picks a random action with probability {@code explorationRate}, otherwise the action with
     * the highest Q-value (first listed on ties).
     */
    public synchronized String selectAction(Map<String, ?> state, List<String> actions) {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("No actions to choose from");
        }
        if (random.nextDouble() < explorationRate) {
            return actions.get(random.nextInt(actions.size()));
        }
        return greedy(StateKeys.of(state), actions);
    }

    private String greedy(String stateKey, List<String> actions) {
        Map<String, Double> values = table.getOrDefault(stateKey, Map.of());
        String best = actions.get(0);
        double bestValue = values.getOrDefault(best, 0.0);
        for (String action : actions.subList(1, actions.size())) {
            double value = values.getOrDefault(action, 0.0);
            if (value > bestValue) {
                best = action;
                bestValue = value;
            }
        }
        return best;
    }

    /** @return the updated Q-value */
    public synchronized double update(Experience experience) {
        String stateKey = StateKeys.of(experience.state());
        double current = qValue(stateKey, experience.action());
        double maxNext = experience.terminal() ? 0.0 : maxValue(StateKeys.of(experience.nextState()));
        double updated = current + learningRate * (experience.reward() + discountFactor * maxNext - current);
        row(stateKey).put(experience.action(), updated);
        log.trace("Q({}, {}) {} -> {}", stateKey, experience.action(), current, updated);
        return updated;
    }

    private double maxValue(String stateKey) {
        Map<String, Double> values = table.get(stateKey);
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        return values.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    private Map<String, Double> row(String stateKey) {
        return table.computeIfAbsent(stateKey, k -> new LinkedHashMap<>());
    }

    public synchronized double qValue(Map<String, ?> state, String action) {
        return qValue(StateKeys.of(state), action);
    }

    public synchronized double qValue(String stateKey, String action) {
        Map<String, Double> values = table.get(stateKey);
        return values != null ? values.getOrDefault(action, 0.0) : 0.0;
    }

    /** Decays the exploration rate toward its floor. */
    public synchronized void endEpisode() {
        episodes++;
        explorationRate = Math.max(minExplorationRate, explorationRate * explorationDecay);
    }

    /** Adds to the replay buffer, evicting the oldest transition when full. */
    public synchronized void remember(Experience experience) {
        if (replayCapacity == 0) {
            return;
        }
        if (replayBuffer.size() >= replayCapacity) {
            replayBuffer.pollFirst();
        }
        replayBuffer.addLast(experience);
    }

    /**
     * Re-applies {@code batchSize} transitions drawn at random from the replay buffer.
     *
     * @return number of updates applied (0 when the buffer holds fewer than {@code batchSize})
     */
    public synchronized int replay(int batchSize) {
        if (batchSize <= 0 || replayBuffer.size() < batchSize) {
            return 0;
        }
        var buffered = new ArrayList<>(replayBuffer);
        for (int i = 0; i < batchSize; i++) {
            update(buffered.get(random.nextInt(buffered.size())));
        }
        return batchSize;
    }

    /** Biases {@code Q(s,a)} by human feedback: {@code Q += alpha * feedback}. */
    public synchronized double applyFeedback(Map<String, ?> state, String action, double feedback) {
        String stateKey = StateKeys.of(state);
        double updated = qValue(stateKey, action) + learningRate * feedback;
        row(stateKey).put(action, updated);
        return updated;
    }

    public synchronized double explorationRate() {
        return explorationRate;
    }

    public synchronized int episodes() {
        return episodes;
    }

    public synchronized int replaySize() {
        return replayBuffer.size();
    }

    public synchronized LearningSnapshot snapshot() {
        return new LearningSnapshot(ENGINE, table, Map.of());
    }

    public synchronized void restore(LearningSnapshot snapshot) {
        if (!ENGINE.equals(snapshot.engine())) {
            throw new LearningStoreException("Cannot restore " + snapshot.engine() + " tables into " + ENGINE);
        }
        table.clear();
        snapshot.tables().forEach((state, values) -> table.put(state, new LinkedHashMap<>(values)));
        log.info("Restored Q-table with {} states", table.size());
    }
}
