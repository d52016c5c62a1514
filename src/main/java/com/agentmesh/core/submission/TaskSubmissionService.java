package com.agentmesh.core.submission;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;
import com.agentmesh.core.orchestrator.Orchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Inbound entry point: accepts tasks, runs each through the orchestrator on the submission
 * executor and lets callers poll or wait for the outcome by task id.
 * <p>
 * Finished submissions are kept for lookup until more than {@code retainedTasks} have finished
 * after them; running ones are always kept.
 */
public class TaskSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

    static final int DEFAULT_RETAINED_TASKS = 1000;

    private static final class Submission {
        final Task task;
        final CompletableFuture<Result> result = new CompletableFuture<>();
        volatile boolean started;

        Submission(Task task) {
            this.task = task;
        }
    }

    private final Orchestrator orchestrator;
    private final ExecutorService submissionExecutor;
    private final int retainedTasks;
    private final ConcurrentHashMap<String, Submission> submissions = new ConcurrentHashMap<>();
    private final ArrayDeque<String> finished = new ArrayDeque<>();

    public TaskSubmissionService(Orchestrator orchestrator, ExecutorService submissionExecutor) {
        this(orchestrator, submissionExecutor, DEFAULT_RETAINED_TASKS);
    }

    public TaskSubmissionService(Orchestrator orchestrator, ExecutorService submissionExecutor, int retainedTasks) {
        if (retainedTasks < 0) {
            throw new IllegalArgumentException("Retained task count must not be negative: " + retainedTasks);
        }
        this.orchestrator = orchestrator;
        this.submissionExecutor = submissionExecutor;
        this.retainedTasks = retainedTasks;
    }

    /**
     * Queues a new task for processing.
     *
     * @return the id of the created task
     * @throws IllegalArgumentException if the description is blank
     */
    public String submitTask(String description, List<String> requirements, int priority,
                             Map<String, Object> context) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        return submit(Task.of(description, requirements, priority, context));
    }

    public String submit(Task task) {
        var submission = new Submission(task);
        if (submissions.putIfAbsent(task.id(), submission) != null) {
            throw new IllegalArgumentException("Task " + task.id() + " was already submitted");
        }
        submission.result.whenComplete((result, error) -> retire(task.id()));
        log.info("Accepted task {} ({} requirement(s), priority {})",
                task.id(), task.requirements().size(), task.priority());
        try {
            submissionExecutor.execute(() -> run(submission));
        } catch (RejectedExecutionException e) {
            log.error("Task {} could not be scheduled", task.id(), e);
            submission.result.complete(Result.failure(task.id(), Orchestrator.AGENT_ID,
                    "Submission rejected: " + e.getMessage(), Duration.ZERO));
        }
        return task.id();
    }

    private void run(Submission submission) {
        submission.started = true;
        try {
            submission.result.complete(orchestrator.processTask(submission.task));
        } catch (RuntimeException e) {
            log.error("Task {} aborted", submission.task.id(), e);
            submission.result.complete(Result.failure(submission.task.id(), Orchestrator.AGENT_ID,
                    "Processing aborted: " + e.getMessage(), Duration.ZERO));
        }
    }

    private void retire(String taskId) {
        synchronized (finished) {
            finished.addLast(taskId);
            while (finished.size() > retainedTasks) {
                submissions.remove(finished.removeFirst());
            }
        }
    }

    /**
     * Waits up to {@code timeout} for the task's synthesized result.
     *
     * @return the result, or empty if the task is unknown or still running after the timeout
     */
    public Optional<Result> awaitResult(String taskId, Duration timeout) {
        Submission submission = submissions.get(taskId);
        if (submission == null) {
            log.debug("No submission with id {}", taskId);
            return Optional.empty();
        }
        try {
            return Optional.of(submission.result.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            // Results are always completed normally; treat anything else as a failed task
            return Optional.of(Result.failure(taskId, Orchestrator.AGENT_ID,
                    String.valueOf(e.getCause()), Duration.ZERO));
        }
    }

    public Optional<TaskStatus> statusOf(String taskId) {
        Submission submission = submissions.get(taskId);
        if (submission == null) {
            return Optional.empty();
        }
        if (submission.result.isDone()) {
            Result result = submission.result.getNow(null);
            return Optional.of(result != null && result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED);
        }
        return Optional.of(submission.started ? TaskStatus.RUNNING : TaskStatus.PENDING);
    }

    /** Drops a finished submission; a running one is kept. */
    public boolean forget(String taskId) {
        Submission submission = submissions.get(taskId);
        return submission != null && submission.result.isDone() && submissions.remove(taskId, submission);
    }

    public int trackedCount() {
        return submissions.size();
    }
}
