package com.agentmesh.core.agent;

import com.agentmesh.core.bus.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the worker runtimes, in registration order, and starts and stops them with the
 * application context.
 */
public class WorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final MessageBus bus;
    private final Duration pollInterval;
    private final CopyOnWriteArrayList<WorkerRuntime> runtimes = new CopyOnWriteArrayList<>();
    private final Map<String, WorkerRuntime> byId = new ConcurrentHashMap<>();
    private volatile boolean running;

    public WorkerPool(MessageBus bus, Duration pollInterval, List<? extends WorkerAgent> agents) {
        this.bus = bus;
        this.pollInterval = pollInterval;
        agents.forEach(this::add);
    }

    /**
     * Adds a worker; it starts at once when the pool is already running.
     *
     * @throws IllegalArgumentException if a worker with the same id exists
     */
    public synchronized WorkerRuntime add(WorkerAgent agent) {
        if (byId.containsKey(agent.agentId())) {
            throw new IllegalArgumentException("Duplicate worker id: " + agent.agentId());
        }
        var runtime = new WorkerRuntime(agent, bus, pollInterval);
        byId.put(agent.agentId(), runtime);
        runtimes.add(runtime);
        if (running) {
            runtime.start();
        }
        return runtime;
    }

    public synchronized boolean remove(String agentId) {
        WorkerRuntime runtime = byId.remove(agentId);
        if (runtime == null) {
            return false;
        }
        runtimes.remove(runtime);
        runtime.stop();
        return true;
    }

    public List<WorkerRuntime> runtimes() {
        return List.copyOf(runtimes);
    }

    public Optional<WorkerRuntime> runtime(String agentId) {
        return Optional.ofNullable(byId.get(agentId));
    }

    /** Running workers not currently processing a task, in registration order. */
    public List<WorkerRuntime> idleWorkers() {
        return runtimes.stream().filter(r -> r.isRunning() && !r.isBusy()).toList();
    }

    public List<WorkerStatus> status() {
        return runtimes.stream().map(WorkerRuntime::status).toList();
    }

    public int size() {
        return runtimes.size();
    }

    @Override
    public synchronized void start() {
        runtimes.forEach(WorkerRuntime::start);
        running = true;
        log.info("Worker pool started with {} worker(s)", runtimes.size());
    }

    @Override
    public synchronized void stop() {
        running = false;
        runtimes.forEach(WorkerRuntime::stop);
        log.info("Worker pool stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
