package com.agentmesh;

import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.health.HealthCheckService;
import com.agentmesh.core.health.HealthStatus;
import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.llm.UnavailableReasoningClient;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.orchestrator.Orchestrator;
import com.agentmesh.core.submission.TaskSubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AgentMeshApplicationTest {

    @Autowired
    private WorkerPool workerPool;

    @Autowired
    private ReasoningClient reasoningClient;

    @Autowired
    private HealthCheckService healthCheckService;

    @Autowired
    private TaskSubmissionService submissionService;

    @Autowired
    private Orchestrator orchestrator;

    @Test
    @DisplayName("context starts the five workers without a chat model")
    void contextLoads() {
        assertTrue(workerPool.isRunning());
        assertEquals(5, workerPool.size());
        assertInstanceOf(UnavailableReasoningClient.class, reasoningClient);

        var statuses = healthCheckService.checkAll();
        assertEquals(HealthStatus.Status.UP, statuses.get(1).status());
        assertEquals(HealthStatus.Status.DEGRADED, statuses.get(2).status());
    }

    @Test
    @DisplayName("an analysis task runs end to end through the real workers")
    void analysisTask() {
        String id = submissionService.submitTask("Analyze the latency samples", List.of("analyze"), 5,
                Map.of("data", List.of(12, 15, 11, 40)));

        var result = submissionService.awaitResult(id, Duration.ofSeconds(30)).orElseThrow();

        assertTrue(result.success(), () -> "unexpected failure: " + result.error());
        assertEquals(List.of("analysis-1"), result.metadata().get("agents_used"));
        assertTrue(orchestrator.efficiencyMetrics().totalTasks() >= 1);
    }

    @Test
    @DisplayName("a research and code task is split across two workers")
    void researchAndCode() {
        var result = orchestrator.processTask(Task.of("Research backoff strategies and code a retry helper",
                "research", "code"));

        assertTrue(result.success(), () -> "unexpected failure: " + result.error());
        assertEquals(2L, result.metadata().get("successful_subtasks"));
        assertEquals(List.of("research-1", "code-1"), result.metadata().get("agents_used"));
    }
}
