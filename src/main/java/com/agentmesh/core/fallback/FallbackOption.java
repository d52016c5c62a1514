package com.agentmesh.core.fallback;

import java.time.Duration;

/**
 * An alternative handler registered on a {@link FallbackChain}, with its running statistics.
 * <p>
 * Counters only grow. Updates are serialized on the option itself, so options of the same chain
 * never share a lock.
 */
public final class FallbackOption<T, R> {

    private final String name;
    private final FallbackHandler<T, R> handler;
    private final int priority;
    private final double weight;

    private long successCount;
    private long failureCount;
    private double averageLatencySeconds;

    FallbackOption(String name, FallbackHandler<T, R> handler, int priority, double weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("Weight must not be negative: " + weight);
        }
        this.name = name;
        this.handler = handler;
        this.priority = priority;
        this.weight = weight;
    }

    public String name() { return name; }
    public int priority() { return priority; }
    public double weight() { return weight; }

    FallbackHandler<T, R> handler() {
        return handler;
    }

    synchronized void recordSuccess(Duration latency) {
        successCount++;
        updateLatency(latency);
    }

    synchronized void recordFailure(Duration latency) {
        failureCount++;
        updateLatency(latency);
    }

    private void updateLatency(Duration latency) {
        long attempts = successCount + failureCount;
        double seconds = latency.toNanos() / 1_000_000_000.0;
        averageLatencySeconds += (seconds - averageLatencySeconds) / attempts;
    }

    public synchronized long successCount() {
        return successCount;
    }

    public synchronized long failureCount() {
        return failureCount;
    }

    public synchronized double averageLatencySeconds() {
        return averageLatencySeconds;
    }

    /** Success ratio over all attempts; 1.0 before the first attempt. */
    public synchronized double successRate() {
        long attempts = successCount + failureCount;
        return attempts == 0 ? 1.0 : (double) successCount / attempts;
    }

    /** Ranking used by {@link FallbackStrategy#ADAPTIVE}. */
    public synchronized double adaptiveScore() {
        return 0.7 * successRate() + 0.3 * (1.0 / (1.0 + averageLatencySeconds));
    }

    public synchronized OptionStatistics statistics() {
        return new OptionStatistics(name, priority, weight, successCount, failureCount,
                successRate(), averageLatencySeconds * 1000.0);
    }

    /**
     * Point-in-time view of an option's counters.
     */
    public record OptionStatistics(
        String name,
        int priority,
        double weight,
        long successCount,
        long failureCount,
        double successRate,
        double averageLatencyMs
    ) {}
}
