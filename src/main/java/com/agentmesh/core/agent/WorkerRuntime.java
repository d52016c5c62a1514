package com.agentmesh.core.agent;

import com.agentmesh.core.bus.Message;
import com.agentmesh.core.bus.MessageBus;
import com.agentmesh.core.bus.MessageType;
import com.agentmesh.core.logging.MdcContext;
import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one {@link WorkerAgent} on its own thread, taking task assignments from the message bus
 * and replying with the result.
 * <p>
 * The busy flag is set for exactly the duration of {@link WorkerAgent#processTask}; delegation
 * reads it to skip workers that are mid-task. Performance starts at 1.0 and follows outcome
 * quality as an exponential moving average bounded to [0.1, 1.0].
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    static final double PERFORMANCE_DECAY = 0.9;
    static final double MIN_PERFORMANCE = 0.1;

    private final WorkerAgent agent;
    private final MessageBus bus;
    private final Duration pollInterval;

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile double performanceScore = 1.0;
    private volatile Thread thread;

    public WorkerRuntime(WorkerAgent agent, MessageBus bus, Duration pollInterval) {
        this.agent = agent;
        this.bus = bus;
        this.pollInterval = pollInterval;
    }

    public String agentId() {
        return agent.agentId();
    }

    public WorkerAgent agent() {
        return agent;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        bus.register(agent.agentId());
        var worker = new Thread(this::runLoop, "worker-" + agent.agentId());
        worker.setDaemon(true);
        thread = worker;
        worker.start();
        log.info("Worker {} ({}) started", agent.agentId(), agent.agentType());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        bus.unregister(agent.agentId());
        Thread worker = thread;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(pollInterval.toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Worker {} stopped ({} completed, {} failed)", agent.agentId(), completed.get(), failed.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runLoop() {
        MdcContext.setAgent(agent.agentId());
        try {
            while (running.get()) {
                Optional<Message> next = bus.receive(agent.agentId(), pollInterval);
                if (next.isEmpty()) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    continue;
                }
                handle(next.get());
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void handle(Message message) {
        switch (message.type()) {
            case TASK_ASSIGNMENT -> {
                if (!(message.payload() instanceof Task task)) {
                    log.warn("Assignment {} carried no task ({})", message.id(),
                            message.payload() == null ? "null" : message.payload().getClass().getSimpleName());
                    return;
                }
                Result result = execute(task);
                if (!bus.send(message.replyTo(agent.agentId(), MessageType.TASK_RESULT, result))) {
                    log.warn("Result for {} could not be delivered to {}", task.id(), message.sender());
                }
            }
            case HEARTBEAT -> {
                if (message.requiresResponse()) {
                    bus.send(message.replyTo(agent.agentId(), MessageType.HEARTBEAT, status()));
                }
            }
            default -> log.debug("Ignoring {} message {} from {}", message.type(), message.id(), message.sender());
        }
    }

    /**
     * Runs the agent on {@code task}, holding the busy flag for the duration. Exceptions thrown
     * by the agent become a failed result.
     */
    public Result execute(Task task) {
        if (!busy.compareAndSet(false, true)) {
            return Result.failure(task.id(), agent.agentId(), "Agent " + agent.agentId() + " is busy", Duration.ZERO);
        }
        MdcContext.setSubtask(task.parentTaskId(), task.id(), agent.agentId());
        long start = System.nanoTime();
        try {
            Result result;
            try {
                log.info("Processing {}", task.id());
                result = agent.processTask(task);
            } catch (RuntimeException e) {
                log.error("Agent {} threw while processing {}", agent.agentId(), task.id(), e);
                result = Result.failure(task.id(), agent.agentId(), e.getClass().getSimpleName() + ": " + e.getMessage(),
                        Duration.ofNanos(System.nanoTime() - start));
            } finally {
                busy.set(false);
            }
            if (result.success()) {
                completed.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
            log.info("Finished {} (success={}, quality={})", task.id(), result.success(), result.qualityScore());
            return result;
        } finally {
            MdcContext.clear();
            if (Thread.currentThread() == thread) {
                MdcContext.setAgent(agent.agentId());
            }
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /** {@code completed / (completed + failed)}, 1.0 with no history. */
    public double successRate() {
        long done = completed.get();
        long total = done + failed.get();
        return total == 0 ? 1.0 : (double) done / total;
    }

    public double performanceScore() {
        return performanceScore;
    }

    /** {@code perf = 0.9*perf + 0.1*quality}, clamped to [0.1, 1.0]. */
    public synchronized double updatePerformance(double quality) {
        double updated = PERFORMANCE_DECAY * performanceScore + (1.0 - PERFORMANCE_DECAY) * quality;
        performanceScore = Math.max(MIN_PERFORMANCE, Math.min(1.0, updated));
        return performanceScore;
    }

    public WorkerStatus status() {
        return new WorkerStatus(
                agent.agentId(),
                agent.agentType(),
                agent.capabilities().stream().map(AgentCapability::name).toList(),
                busy.get(),
                completed.get(),
                failed.get(),
                successRate(),
                performanceScore,
                bus.queueSize(agent.agentId()));
    }
}
