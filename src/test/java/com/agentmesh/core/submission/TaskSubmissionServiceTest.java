package com.agentmesh.core.submission;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;
import com.agentmesh.core.orchestrator.Orchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskSubmissionServiceTest {

    private Orchestrator orchestrator;
    private ExecutorService executor;
    private TaskSubmissionService service;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        executor = Executors.newSingleThreadExecutor();
        service = new TaskSubmissionService(orchestrator, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("a submitted task's result can be awaited by id")
    void awaitResult() {
        when(orchestrator.processTask(any())).thenAnswer(inv -> {
            Task task = inv.getArgument(0);
            return Result.success(task.id(), Orchestrator.AGENT_ID, List.of(), Duration.ofMillis(5), 0.8);
        });

        String id = service.submitTask("Summarise the incident", List.of("document"), 5, Map.of());
        var result = service.awaitResult(id, Duration.ofSeconds(5)).orElseThrow();

        assertTrue(result.success());
        assertEquals(id, result.taskId());
        assertEquals(TaskStatus.COMPLETED, service.statusOf(id).orElseThrow());
    }

    @Test
    @DisplayName("a blank description is rejected")
    void blankDescription() {
        assertThrows(IllegalArgumentException.class, () -> service.submitTask("  ", List.of(), 5, Map.of()));
        assertEquals(0, service.trackedCount());
    }

    @Test
    @DisplayName("an orchestrator exception becomes a failed result")
    void orchestratorThrows() {
        when(orchestrator.processTask(any())).thenThrow(new IllegalStateException("bus down"));

        String id = service.submit(Task.of("Anything"));
        var result = service.awaitResult(id, Duration.ofSeconds(5)).orElseThrow();

        assertFalse(result.success());
        assertEquals("Processing aborted: bus down", result.error());
        assertEquals(TaskStatus.FAILED, service.statusOf(id).orElseThrow());
    }

    @Test
    @DisplayName("waiting past the timeout returns empty while the task keeps running")
    void timeout() throws InterruptedException {
        var release = new CountDownLatch(1);
        when(orchestrator.processTask(any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            Task task = inv.getArgument(0);
            return Result.success(task.id(), Orchestrator.AGENT_ID, null, Duration.ZERO, 1.0);
        });

        String id = service.submit(Task.of("Slow one"));

        assertTrue(service.awaitResult(id, Duration.ofMillis(50)).isEmpty());
        assertFalse(service.forget(id));
        release.countDown();
        assertTrue(service.awaitResult(id, Duration.ofSeconds(5)).isPresent());
        assertTrue(service.forget(id));
        assertTrue(service.statusOf(id).isEmpty());
    }

    @Test
    @DisplayName("a rejected submission completes as failed")
    void rejected() {
        executor.shutdownNow();

        String id = service.submit(Task.of("Too late"));
        var result = service.awaitResult(id, Duration.ofSeconds(1)).orElseThrow();

        assertFalse(result.success());
        assertTrue(result.error().startsWith("Submission rejected"));
    }

    @Test
    @DisplayName("unknown ids have no status and no result")
    void unknownId() {
        assertTrue(service.statusOf("task-nope").isEmpty());
        assertTrue(service.awaitResult("task-nope", Duration.ofMillis(10)).isEmpty());
    }

    @Test
    @DisplayName("only the most recently finished submissions stay tracked")
    void finishedSubmissionsAreEvicted() throws Exception {
        when(orchestrator.processTask(any())).thenAnswer(inv -> {
            Task task = inv.getArgument(0);
            return Result.success(task.id(), Orchestrator.AGENT_ID, null, Duration.ZERO, 1.0);
        });
        var bounded = new TaskSubmissionService(orchestrator, executor, 2);

        var ids = new ArrayList<String>();
        for (int i = 0; i < 4; i++) {
            ids.add(bounded.submit(Task.of("Job " + i)));
        }
        // the single worker thread retires each submission before running the next job
        executor.submit(() -> { }).get(5, TimeUnit.SECONDS);

        assertEquals(2, bounded.trackedCount());
        assertTrue(bounded.statusOf(ids.get(0)).isEmpty());
        assertTrue(bounded.statusOf(ids.get(1)).isEmpty());
        assertEquals(TaskStatus.COMPLETED, bounded.statusOf(ids.get(3)).orElseThrow());
        assertTrue(bounded.awaitResult(ids.get(2), Duration.ofSeconds(1)).isPresent());
    }

    @Test
    @DisplayName("the same task cannot be submitted twice")
    void duplicateSubmission() {
        var release = new CountDownLatch(1);
        when(orchestrator.processTask(any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            Task task = inv.getArgument(0);
            return Result.success(task.id(), Orchestrator.AGENT_ID, null, Duration.ZERO, 1.0);
        });
        var task = Task.of("Once only");

        service.submit(task);
        assertThrows(IllegalArgumentException.class, () -> service.submit(task));
        release.countDown();
    }
}
