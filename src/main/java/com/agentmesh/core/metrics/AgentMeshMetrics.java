package com.agentmesh.core.metrics;

import com.agentmesh.core.bus.MessageBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class AgentMeshMetrics {

    private final MeterRegistry registry;

    public AgentMeshMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskOutcome(String outcome) {
        Counter.builder("agentmesh.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSubtaskExecution(String agentId, Duration elapsed) {
        Timer.builder("agentmesh.subtask.duration")
                .tag("agent", agentId)
                .register(registry)
                .record(elapsed);
    }

    public void recordComplexity(String level, double score) {
        DistributionSummary.builder("agentmesh.complexity.score")
                .tag("level", level)
                .register(registry)
                .record(score);
    }

    public void recordDelegation(String agentId) {
        Counter.builder("agentmesh.delegations.total")
                .tag("agent", agentId)
                .register(registry)
                .increment();
    }

    /**
     * Records a fallback chain running out of options.
     *
     * @param chainName the exhausted chain
     */
    public void recordFallbackExhausted(String chainName) {
        Counter.builder("agentmesh.fallback.exhausted")
                .description("Fallback chains whose primary and every option failed")
                .tag("chain", chainName)
                .register(registry)
                .increment();
    }

    /** Exposes the bus drop and expiry counters as gauges. */
    public void bindMessageBus(MessageBus bus) {
        Gauge.builder("agentmesh.bus.dropped", bus, b -> b.statistics().dropped())
                .description("Messages dropped because the recipient was unknown or its queue was full")
                .register(registry);
        Gauge.builder("agentmesh.bus.expired", bus, b -> b.statistics().expired())
                .register(registry);
    }
}
