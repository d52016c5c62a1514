package com.agentmesh.core.orchestrator;

import com.agentmesh.core.agent.StubAgent;
import com.agentmesh.core.agent.WorkerAgent;
import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.bus.MessageBus;
import com.agentmesh.core.events.AgentMeshEvent;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.metrics.AgentMeshMetrics;
import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.SubtaskSummary;
import com.agentmesh.core.model.SynthesisOutcome;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStage;
import com.agentmesh.core.model.TaskStatus;
import com.agentmesh.core.persistence.InMemoryTaskStore;
import com.agentmesh.core.scaling.LoadBalancer;
import com.agentmesh.core.scaling.ScalingStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorTest {

    private final MessageBus bus = new MessageBus();
    private final EventBus eventBus = new EventBus();
    private final InMemoryTaskStore taskStore = new InMemoryTaskStore();
    private final LoadBalancer loadBalancer = new LoadBalancer();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ExecutorService dispatchExecutor = Executors.newFixedThreadPool(4);

    private WorkerPool pool;

    private Orchestrator orchestrator(Duration subtaskTimeout, WorkerAgent... agents) {
        pool = new WorkerPool(bus, Duration.ofMillis(20), List.of(agents));
        pool.start();
        return new Orchestrator(bus, pool, new TaskAnalyzer(new ScalingStrategy()), new TaskDecomposer(),
                new DelegationPlanner(pool, loadBalancer), loadBalancer, taskStore, eventBus,
                new AgentMeshMetrics(registry), dispatchExecutor, subtaskTimeout, Duration.ZERO);
    }

    private static StubAgent researcher(double quality) {
        return StubAgent.succeeding("research-1", quality, AgentCapability.of("research", 0.9));
    }

    private static StubAgent coder(double quality) {
        return StubAgent.succeeding("code-1", quality, AgentCapability.of("code", 0.9));
    }

    private static StubAgent failingCoder() {
        return new StubAgent("code-1", List.of(AgentCapability.of("code", 0.9)),
                task -> Result.failure(task.id(), "code-1", "compiler crashed", Duration.ofMillis(2)));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
        bus.shutdown();
        dispatchExecutor.shutdownNow();
    }

    @Nested
    @DisplayName("Research and code task")
    class ResearchAndCode {

        @Test
        @DisplayName("both subtasks succeed and quality is their mean")
        void synthesizes() {
            var orchestrator = orchestrator(Duration.ofSeconds(5), researcher(0.8), coder(0.6));
            var task = Task.of("Research rate limiting and code a token bucket", "research", "code");

            var result = orchestrator.processTask(task);

            assertTrue(result.success());
            assertNull(result.error());
            assertEquals(task.id(), result.taskId());
            assertEquals(Orchestrator.AGENT_ID, result.agentId());
            assertEquals(0.7, result.qualityScore(), 1e-9);
            assertEquals(SynthesisOutcome.SUCCEEDED.name(), result.metadata().get("outcome"));
            assertEquals(List.of("research-1", "code-1"), result.metadata().get("agents_used"));
            assertEquals(2L, result.metadata().get("successful_subtasks"));

            @SuppressWarnings("unchecked")
            var summaries = (List<SubtaskSummary>) result.payload();
            assertEquals(List.of("research-1", "code-1"), summaries.stream().map(SubtaskSummary::agentId).toList());
            assertEquals(task.childTaskIds(), summaries.stream().map(SubtaskSummary::taskId).toList());
        }

        @Test
        @DisplayName("stage, store, performance, load and metrics are updated")
        void bookkeeping() {
            var orchestrator = orchestrator(Duration.ofSeconds(5), researcher(0.8), coder(0.6));
            var task = Task.of("Research rate limiting and code a token bucket", "research", "code");

            orchestrator.processTask(task);

            assertEquals(TaskStage.SYNTHESIZED, orchestrator.stageOf(task.id()).orElseThrow());
            assertEquals(TaskStatus.COMPLETED, taskStore.find(task.id()).orElseThrow().status());
            assertEquals(3, taskStore.size());
            // 0.9 * 1.0 + 0.1 * 0.8
            assertEquals(0.98, pool.runtime("research-1").orElseThrow().performanceScore(), 1e-12);
            assertEquals(0.0, loadBalancer.loadOf("code-1"), 1e-12);

            assertEquals(1.0, registry.find("agentmesh.tasks.total").tag("outcome", "SUCCEEDED").counter().count());
            assertEquals(1.0, registry.find("agentmesh.delegations.total").tag("agent", "code-1").counter().count());
            assertEquals(1, registry.find("agentmesh.subtask.duration").tag("agent", "research-1").timer().count());

            var efficiency = orchestrator.efficiencyMetrics();
            assertEquals(1, efficiency.totalTasks());
            assertEquals(2.0, efficiency.averageAgentsPerTask(), 1e-12);
        }

        @Test
        @DisplayName("lifecycle events are published in order")
        void events() {
            var orchestrator = orchestrator(Duration.ofSeconds(5), researcher(0.8), coder(0.6));
            var task = Task.of("Research rate limiting and code a token bucket", "research", "code");
            var seen = new CopyOnWriteArrayList<AgentMeshEvent>();
            eventBus.subscribe(task.id(), seen::add);

            orchestrator.processTask(task);

            var taskLevel = seen.stream().filter(e -> e.subtaskId() == null).map(AgentMeshEvent::eventType).toList();
            assertEquals(List.of("task.received", "task.analyzed", "task.decomposed", "task.delegated",
                    "task.synthesized"), taskLevel);
            assertEquals(2, seen.stream().filter(e -> e.eventType().equals("subtask.completed")).count());
        }
    }

    @Test
    @DisplayName("one failing subtask gives a partial outcome with its error")
    void partialFailure() {
        var orchestrator = orchestrator(Duration.ofSeconds(5), researcher(0.8), failingCoder());

        var result = orchestrator.processTask(Task.of("Research and code it", "research", "code"));

        assertFalse(result.success());
        assertEquals(SynthesisOutcome.PARTIALLY_SUCCEEDED.name(), result.metadata().get("outcome"));
        assertTrue(result.error().contains("compiler crashed"));
        assertEquals(0.4, result.qualityScore(), 1e-9);
        assertEquals(0.9, pool.runtime("code-1").orElseThrow().performanceScore(), 1e-12);
    }

    @Test
    @DisplayName("a worker that never answers times out without failing the others")
    void timeout() {
        var slow = new StubAgent("code-1", List.of(AgentCapability.of("code", 0.9)), task -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Result.success(task.id(), "code-1", "late", Duration.ofSeconds(2), 1.0);
        });
        var orchestrator = orchestrator(Duration.ofMillis(200), researcher(0.8), slow);

        var result = orchestrator.processTask(Task.of("Research and code it", "research", "code"));

        assertEquals(SynthesisOutcome.PARTIALLY_SUCCEEDED.name(), result.metadata().get("outcome"));
        assertTrue(result.error().contains("Timed out after 200ms"));
    }

    @Test
    @DisplayName("with no workers every subtask fails unassigned")
    void noWorkers() {
        var orchestrator = orchestrator(Duration.ofSeconds(1));

        var result = orchestrator.processTask(Task.of("Research and code it", "research", "code"));

        assertFalse(result.success());
        assertEquals(SynthesisOutcome.FAILED.name(), result.metadata().get("outcome"));
        assertTrue(result.error().contains("No capable worker available"));
        assertEquals(List.of(), result.metadata().get("agents_used"));
    }

    @Test
    @DisplayName("an undecomposed task runs as a single subtask on the best worker")
    void wholeTask() {
        var orchestrator = orchestrator(Duration.ofSeconds(5), researcher(0.8), coder(0.6));
        var task = Task.of("Fix the typo", "code");

        var result = orchestrator.processTask(task);

        assertTrue(result.success());
        assertEquals(List.of("code-1"), result.metadata().get("agents_used"));
        assertTrue(task.childTaskIds().isEmpty());
        assertEquals(1, taskStore.size());
    }

    @Test
    @DisplayName("stages of older finished tasks are dropped beyond the retention limit")
    void finishedStagesAreEvicted() {
        orchestrator(Duration.ofSeconds(5), coder(0.8));
        var bounded = new Orchestrator(bus, pool, new TaskAnalyzer(new ScalingStrategy()), new TaskDecomposer(),
                new DelegationPlanner(pool, loadBalancer), loadBalancer, taskStore, eventBus,
                new AgentMeshMetrics(registry), dispatchExecutor, Duration.ofSeconds(5), Duration.ZERO, 1);
        var first = Task.of("Fix the typo", "code");
        var second = Task.of("Fix the other typo", "code");

        bounded.processTask(first);
        assertEquals(TaskStage.SYNTHESIZED, bounded.stageOf(first.id()).orElseThrow());
        bounded.processTask(second);

        assertTrue(bounded.stageOf(first.id()).isEmpty());
        assertEquals(TaskStage.SYNTHESIZED, bounded.stageOf(second.id()).orElseThrow());
    }
}
