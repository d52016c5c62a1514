package com.agentmesh.core.orchestrator;

import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.agent.WorkerStatus;
import com.agentmesh.core.bus.Message;
import com.agentmesh.core.bus.MessageBus;
import com.agentmesh.core.bus.MessageType;
import com.agentmesh.core.bus.ResponseTimeoutException;
import com.agentmesh.core.events.AgentMeshEvent;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.logging.MdcContext;
import com.agentmesh.core.metrics.AgentMeshMetrics;
import com.agentmesh.core.model.AgentUnavailableException;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.SubtaskSummary;
import com.agentmesh.core.model.SynthesisOutcome;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStage;
import com.agentmesh.core.persistence.TaskStore;
import com.agentmesh.core.scaling.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Top-level coordinator: analyses a task, splits it, assigns the parts to workers, runs them
 * concurrently over the message bus and merges the outcomes into one result.
 * <p>
 * A failing or timed-out subtask becomes an unsuccessful result for that subtask only; nothing
 * thrown by a worker escapes {@link #processTask}. Synthesis waits for every subtask. There is no
 * way to cancel a task once it is running.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    public static final String AGENT_ID = "orchestrator";

    /** Load added to a worker for each subtask it has in flight. */
    static final double LOAD_PER_SUBTASK = 0.25;

    static final int DEFAULT_RETAINED_TASKS = 1000;

    private final MessageBus bus;
    private final WorkerPool workerPool;
    private final TaskAnalyzer analyzer;
    private final TaskDecomposer decomposer;
    private final DelegationPlanner planner;
    private final LoadBalancer loadBalancer;
    private final TaskStore taskStore;
    private final EventBus eventBus;
    private final AgentMeshMetrics metrics;
    private final ExecutorService dispatchExecutor;
    private final Duration subtaskTimeout;
    private final Duration assignmentTtl;
    private final int retainedTasks;

    private final ConcurrentHashMap<String, TaskStage> stages = new ConcurrentHashMap<>();
    // finished task ids, oldest first; their stages are forgotten beyond retainedTasks
    private final ArrayDeque<String> finished = new ArrayDeque<>();
    private final AtomicLong totalTasks = new AtomicLong();
    private final AtomicLong totalAgentsUsed = new AtomicLong();
    private final Map<ComplexityType, AtomicLong> tasksByType = new EnumMap<>(ComplexityType.class);

    public Orchestrator(MessageBus bus, WorkerPool workerPool, TaskAnalyzer analyzer, TaskDecomposer decomposer,
                        DelegationPlanner planner, LoadBalancer loadBalancer, TaskStore taskStore,
                        EventBus eventBus, AgentMeshMetrics metrics, ExecutorService dispatchExecutor,
                        Duration subtaskTimeout, Duration assignmentTtl) {
        this(bus, workerPool, analyzer, decomposer, planner, loadBalancer, taskStore, eventBus, metrics,
                dispatchExecutor, subtaskTimeout, assignmentTtl, DEFAULT_RETAINED_TASKS);
    }

    /**
     * @param retainedTasks how many finished tasks {@link #stageOf} still reports
     */
    public Orchestrator(MessageBus bus, WorkerPool workerPool, TaskAnalyzer analyzer, TaskDecomposer decomposer,
                        DelegationPlanner planner, LoadBalancer loadBalancer, TaskStore taskStore,
                        EventBus eventBus, AgentMeshMetrics metrics, ExecutorService dispatchExecutor,
                        Duration subtaskTimeout, Duration assignmentTtl, int retainedTasks) {
        if (retainedTasks < 0) {
            throw new IllegalArgumentException("Retained task count must not be negative: " + retainedTasks);
        }
        this.bus = bus;
        this.workerPool = workerPool;
        this.analyzer = analyzer;
        this.decomposer = decomposer;
        this.planner = planner;
        this.loadBalancer = loadBalancer;
        this.taskStore = taskStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.dispatchExecutor = dispatchExecutor;
        this.subtaskTimeout = subtaskTimeout;
        this.assignmentTtl = assignmentTtl != null ? assignmentTtl : Duration.ZERO;
        this.retainedTasks = retainedTasks;
        for (ComplexityType type : ComplexityType.values()) {
            tasksByType.put(type, new AtomicLong());
        }
    }

    /**
     * Runs {@code task} to completion and returns the synthesized result. The result's payload
     * is a list of {@link SubtaskSummary}; its metadata carries the {@link SynthesisOutcome}.
     */
    public Result processTask(Task task) {
        MdcContext.setTask(task.id());
        try {
            transition(task, TaskStage.RECEIVED);
            persist(() -> taskStore.saveTask(task), "task " + task.id());
            publish(AgentMeshEvent.TASK_RECEIVED, task, null, Map.of(
                    "requirements", task.requirements(),
                    "priority", task.priority()));

            var analysis = analyzer.analyze(task, workerPool.size());
            transition(task, TaskStage.ANALYZED);
            if (metrics != null) {
                metrics.recordComplexity(analysis.type().label(), analysis.score());
            }
            publish(AgentMeshEvent.TASK_ANALYZED, task, null, Map.of(
                    "complexity_type", analysis.type().label(),
                    "complexity_score", analysis.score(),
                    "scaling_level", analysis.assessment().level().name()));

            List<Task> subtasks = decomposer.decompose(task, analysis);
            boolean decomposed = !(subtasks.size() == 1 && subtasks.get(0) == task);
            transition(task, decomposed ? TaskStage.DECOMPOSED : TaskStage.NOT_DECOMPOSED);
            if (decomposed) {
                subtasks.forEach(s -> persist(() -> taskStore.saveTask(s), "subtask " + s.id()));
            }
            publish(AgentMeshEvent.TASK_DECOMPOSED, task, null, Map.of(
                    "decomposed", decomposed,
                    "subtasks", subtasks.stream().map(Task::id).toList()));

            List<Delegation> delegations = planner.plan(subtasks);
            transition(task, TaskStage.DELEGATED);
            publish(AgentMeshEvent.TASK_DELEGATED, task, null, Map.of("assignments", assignments(delegations)));

            transition(task, TaskStage.EXECUTING);
            List<Result> results = executeAll(task, delegations);

            Result synthesized = synthesize(task, analysis, delegations, results);
            transition(task, TaskStage.SYNTHESIZED);
            updatePerformance(results);
            recordEfficiency(analysis, synthesized);
            if (decomposed) {
                results.forEach(r -> persist(() -> taskStore.saveResult(r), "result " + r.taskId()));
            }
            persist(() -> taskStore.saveResult(synthesized), "result " + task.id());
            if (metrics != null) {
                metrics.recordTaskOutcome(synthesized.metadata().get("outcome").toString());
            }
            publish(AgentMeshEvent.TASK_SYNTHESIZED, task, null, Map.of(
                    "success", synthesized.success(),
                    "outcome", synthesized.metadata().get("outcome"),
                    "quality", synthesized.qualityScore()));
            log.info("Task {} synthesized: {} ({} subtask(s), quality {})", task.id(),
                    synthesized.metadata().get("outcome"), results.size(),
                    String.format("%.2f", synthesized.qualityScore()));
            return synthesized;
        } finally {
            retire(task);
            MdcContext.clear();
        }
    }

    private List<Result> executeAll(Task root, List<Delegation> delegations) {
        var futures = new ArrayList<CompletableFuture<Result>>(delegations.size());
        for (Delegation delegation : delegations) {
            CompletableFuture<Result> future;
            try {
                future = CompletableFuture.supplyAsync(() -> dispatch(root, delegation), dispatchExecutor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(Result.failure(delegation.subtask().id(), AGENT_ID,
                        "Dispatch rejected: " + e.getMessage(), Duration.ZERO));
            }
            futures.add(future.exceptionally(e -> Result.failure(delegation.subtask().id(),
                    delegation.agentId() != null ? delegation.agentId() : AGENT_ID,
                    "Dispatch failed: " + e.getMessage(), Duration.ZERO)));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Result dispatch(Task root, Delegation delegation) {
        Task subtask = delegation.subtask();
        if (!delegation.isAssigned()) {
            return Result.failure(subtask.id(), AGENT_ID, "No capable worker available", Duration.ZERO);
        }
        String agentId = delegation.agentId();
        MdcContext.setSubtask(root.id(), subtask.id(), agentId);
        try {
            if (metrics != null) {
                metrics.recordDelegation(agentId);
            }
            publish(AgentMeshEvent.SUBTASK_STARTED, root, subtask.id(), Map.of("agent", agentId));
            loadBalancer.adjustLoad(agentId, LOAD_PER_SUBTASK);

            Result result;
            try {
                var assignment = Message.request(AGENT_ID, agentId, MessageType.TASK_ASSIGNMENT,
                        subtask.priority(), subtask, assignmentTtl);
                Message reply = bus.sendAndWaitResponse(assignment, subtaskTimeout);
                if (reply.payload() instanceof Result r) {
                    result = r;
                } else {
                    result = Result.failure(subtask.id(), agentId, "Unexpected reply from " + agentId
                            + ": " + reply.type(), Duration.ZERO);
                }
            } catch (ResponseTimeoutException e) {
                log.warn("Subtask {} timed out on {}", subtask.id(), agentId);
                result = Result.failure(subtask.id(), agentId, "Timed out after " + subtaskTimeout.toMillis() + "ms",
                        subtaskTimeout);
            } catch (AgentUnavailableException e) {
                log.warn("Subtask {} could not run on {}: {}", subtask.id(), agentId, e.getMessage());
                result = Result.failure(subtask.id(), agentId, e.getMessage(), Duration.ZERO);
            } finally {
                loadBalancer.adjustLoad(agentId, -LOAD_PER_SUBTASK);
            }

            if (metrics != null) {
                metrics.recordSubtaskExecution(agentId, result.executionTime());
            }
            var payload = new HashMap<String, Object>();
            payload.put("agent", agentId);
            payload.put("success", result.success());
            payload.put("quality", result.qualityScore());
            if (result.error() != null) {
                payload.put("error", result.error());
            }
            publish(AgentMeshEvent.SUBTASK_COMPLETED, root, subtask.id(), payload);
            return result;
        } finally {
            MdcContext.setTask(root.id());
        }
    }

    /**
     * Success is the AND of all subtask outcomes, quality their mean and execution time their
     * maximum, since subtasks run in parallel.
     */
    Result synthesize(Task task, TaskAnalysis analysis, List<Delegation> delegations, List<Result> results) {
        boolean success = !results.isEmpty() && results.stream().allMatch(Result::success);
        double quality = results.stream().mapToDouble(Result::qualityScore).average().orElse(0.0);
        Duration elapsed = results.stream().map(Result::executionTime).max(Duration::compareTo).orElse(Duration.ZERO);
        long succeeded = results.stream().filter(Result::success).count();
        var agentsUsed = delegations.stream().filter(Delegation::isAssigned).map(Delegation::agentId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        var metadata = new HashMap<String, Object>();
        metadata.put("outcome", SynthesisOutcome.of(results).name());
        metadata.put("complexity_type", analysis.type().label());
        metadata.put("complexity_score", analysis.score());
        metadata.put("agents_used", List.copyOf(agentsUsed));
        metadata.put("agents_available", workerPool.size());
        metadata.put("successful_subtasks", succeeded);
        metadata.put("failed_subtasks", results.size() - succeeded);

        String error = success ? null : results.stream()
                .filter(r -> !r.success())
                .map(r -> r.taskId() + ": " + r.error())
                .collect(Collectors.joining("; "));
        return new Result(task.id(), success, results.stream().map(SubtaskSummary::from).toList(), error,
                AGENT_ID, elapsed, quality, metadata);
    }

    private void updatePerformance(List<Result> results) {
        for (Result result : results) {
            workerPool.runtime(result.agentId()).ifPresent(runtime -> {
                double updated = runtime.updatePerformance(result.success() ? result.qualityScore() : 0.0);
                log.debug("Performance of {} now {}", runtime.agentId(), updated);
            });
        }
    }

    private void recordEfficiency(TaskAnalysis analysis, Result synthesized) {
        totalTasks.incrementAndGet();
        tasksByType.get(analysis.type()).incrementAndGet();
        Object used = synthesized.metadata().get("agents_used");
        if (used instanceof List<?> agents) {
            totalAgentsUsed.addAndGet(agents.size());
        }
    }

    private void transition(Task task, TaskStage stage) {
        stages.put(task.id(), stage);
        log.debug("Task {} -> {}", task.id(), stage);
    }

    private void retire(Task task) {
        synchronized (finished) {
            finished.addLast(task.id());
            while (finished.size() > retainedTasks) {
                stages.remove(finished.removeFirst());
            }
        }
    }

    private void persist(Runnable write, String what) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("Failed to persist {}: {}", what, e.getMessage());
        }
    }

    private void publish(String eventType, Task task, String subtaskId, Map<String, Object> payload) {
        eventBus.publish(subtaskId == null
                ? AgentMeshEvent.of(eventType, task.id(), payload)
                : AgentMeshEvent.forSubtask(eventType, task.id(), subtaskId, payload));
    }

    private static Map<String, String> assignments(List<Delegation> delegations) {
        var assignments = new HashMap<String, String>();
        delegations.forEach(d -> assignments.put(d.subtask().id(), d.isAssigned() ? d.agentId() : "unassigned"));
        return assignments;
    }

    /** Stage of a running task or of one of the most recently finished ones. */
    public Optional<TaskStage> stageOf(String taskId) {
        return Optional.ofNullable(stages.get(taskId));
    }

    public EfficiencyMetrics efficiencyMetrics() {
        long total = totalTasks.get();
        return new EfficiencyMetrics(
                total,
                tasksByType.get(ComplexityType.SIMPLE).get(),
                tasksByType.get(ComplexityType.MODERATE).get(),
                tasksByType.get(ComplexityType.COMPLEX).get(),
                total == 0 ? 0.0 : (double) totalAgentsUsed.get() / total);
    }

    public List<WorkerStatus> workerStatus() {
        return workerPool.status();
    }
}
