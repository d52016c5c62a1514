package com.agentmesh.core.health;

import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.bus.MessageBus;
import com.agentmesh.core.llm.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MessageBus messageBus;
    private final WorkerPool workerPool;
    private final ReasoningClient reasoningClient;
    // dropped-message count seen by the previous bus check
    private final AtomicLong lastDropped = new AtomicLong();

    public HealthCheckService(MessageBus messageBus, WorkerPool workerPool, ReasoningClient reasoningClient) {
        this.messageBus = messageBus;
        this.workerPool = workerPool;
        this.reasoningClient = reasoningClient;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBus());
        results.add(checkWorkers());
        results.add(checkReasoning());
        return results;
    }

    /** DEGRADED only when messages were dropped since the previous check. */
    private HealthStatus checkBus() {
        var stats = messageBus.statistics();
        long recentlyDropped = stats.dropped() - lastDropped.getAndSet(stats.dropped());
        var metadata = Map.of(
                "registered", String.valueOf(stats.registeredAgents()),
                "total", String.valueOf(stats.totalMessages()),
                "dropped", String.valueOf(stats.dropped()),
                "dropped_since_last_check", String.valueOf(recentlyDropped),
                "expired", String.valueOf(stats.expired()));
        if (recentlyDropped > 0) {
            return new HealthStatus("bus", HealthStatus.Status.DEGRADED,
                    recentlyDropped + " message(s) dropped since the last check", metadata);
        }
        return new HealthStatus("bus", HealthStatus.Status.UP,
                stats.registeredAgents() + " agent(s) registered", metadata);
    }

    private HealthStatus checkWorkers() {
        int total = workerPool.size();
        int idle = workerPool.idleWorkers().size();
        var metadata = Map.of("total", String.valueOf(total), "idle", String.valueOf(idle));
        if (total == 0 || !workerPool.isRunning()) {
            return new HealthStatus("workers", HealthStatus.Status.DOWN,
                    total == 0 ? "No workers registered" : "Worker pool not running", metadata);
        }
        if (idle == 0) {
            return new HealthStatus("workers", HealthStatus.Status.DEGRADED,
                    "All " + total + " worker(s) busy", metadata);
        }
        return new HealthStatus("workers", HealthStatus.Status.UP,
                idle + " of " + total + " worker(s) idle", metadata);
    }

    private HealthStatus checkReasoning() {
        try {
            if (reasoningClient.isAvailable()) {
                return new HealthStatus("reasoning", HealthStatus.Status.UP,
                        "Reasoning backend available (" + reasoningClient.getClass().getSimpleName() + ")",
                        Map.of());
            }
            return new HealthStatus("reasoning", HealthStatus.Status.DEGRADED,
                    "No reasoning backend, agents use local fallbacks", Map.of());
        } catch (RuntimeException e) {
            log.warn("Reasoning health check failed: {}", e.getMessage());
            return new HealthStatus("reasoning", HealthStatus.Status.DEGRADED,
                    "Reasoning error: " + e.getMessage(), Map.of());
        }
    }
}
