package com.agentmesh.core.persistence;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private final InMemoryTaskStore store = new InMemoryTaskStore();

    @Test
    @DisplayName("a saved task is pending until a subtask is saved")
    void pendingThenRunning() {
        var parent = Task.of("Build it", "research", "code");
        store.saveTask(parent);
        assertEquals(TaskStatus.PENDING, store.find(parent.id()).orElseThrow().status());

        store.saveTask(Task.subtaskOf(parent, "Research it", List.of("research"), Map.of()));

        assertEquals(TaskStatus.RUNNING, store.find(parent.id()).orElseThrow().status());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("a result completes or fails its task")
    void results() {
        var ok = Task.of("Works");
        var broken = Task.of("Breaks");
        store.saveTask(ok);
        store.saveTask(broken);

        store.saveResult(Result.success(ok.id(), "code-1", "done", Duration.ofMillis(3), 0.9));
        store.saveResult(Result.failure(broken.id(), "code-1", "crashed", Duration.ZERO));

        var okRecord = store.find(ok.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, okRecord.status());
        assertEquals("done", okRecord.result().payload());
        assertEquals(TaskStatus.FAILED, store.find(broken.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("a result for an unknown task is dropped")
    void unknownResult() {
        store.saveResult(Result.success("task-missing", "code-1", null, Duration.ZERO, 1.0));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("query filters by status and honours the limit")
    void query() {
        var first = Task.of("first");
        var second = Task.of("second");
        var third = Task.of("third");
        store.saveTask(first);
        store.saveTask(second);
        store.saveTask(third);
        store.saveResult(Result.success(second.id(), "a", null, Duration.ZERO, 1.0));

        assertEquals(3, store.queryTasks(null, 10).size());
        assertEquals(2, store.queryTasks(null, 2).size());
        assertEquals(List.of(second.id()),
                store.queryTasks(TaskStatus.COMPLETED, 10).stream().map(r -> r.task().id()).toList());
        assertTrue(store.queryTasks(null, -1).isEmpty());
    }
}
