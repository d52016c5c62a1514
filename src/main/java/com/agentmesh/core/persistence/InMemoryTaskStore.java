package com.agentmesh.core.persistence;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link TaskStore}: keeps everything in memory for the life of the process.
 * <p>
 * A saved task starts {@link TaskStatus#PENDING} and turns RUNNING once it has a subtask; its
 * result makes it COMPLETED or FAILED. A result for a task that was never saved is dropped with
 * a warning.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ConcurrentHashMap<String, TaskRecord> records = new ConcurrentHashMap<>();

    @Override
    public void saveTask(Task task) {
        records.merge(task.id(), new TaskRecord(task, TaskStatus.PENDING, null),
                (existing, fresh) -> new TaskRecord(task, existing.status(), existing.result()));
        if (task.parentTaskId() != null) {
            records.computeIfPresent(task.parentTaskId(), (id, parent) -> parent.status() == TaskStatus.PENDING
                    ? new TaskRecord(parent.task(), TaskStatus.RUNNING, parent.result())
                    : parent);
        }
    }

    @Override
    public void saveResult(Result result) {
        TaskStatus status = result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        TaskRecord updated = records.computeIfPresent(result.taskId(),
                (id, existing) -> new TaskRecord(existing.task(), status, result));
        if (updated == null) {
            log.warn("Result for unknown task {} not stored", result.taskId());
        }
    }

    @Override
    public List<TaskRecord> queryTasks(TaskStatus status, int limit) {
        return records.values().stream()
                .filter(r -> status == null || r.status() == status)
                .sorted(Comparator.comparing((TaskRecord r) -> r.task().createdAt()).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public Optional<TaskRecord> find(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    public int size() {
        return records.size();
    }
}
