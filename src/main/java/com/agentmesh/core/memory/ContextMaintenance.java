package com.agentmesh.core.memory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes expired context entries.
 */
public class ContextMaintenance {

    private static final Logger log = LoggerFactory.getLogger(ContextMaintenance.class);

    private final ContextProtocol contextProtocol;
    private final Duration interval;

    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "context-sweeper");
        t.setDaemon(true);
        return t;
    });

    public ContextMaintenance(ContextProtocol contextProtocol, Duration interval) {
        this.contextProtocol = contextProtocol;
        this.interval = interval;
    }

    @PostConstruct
    void start() {
        sweeper.scheduleWithFixedDelay(this::sweep, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Context sweeper started (interval={}ms)", interval.toMillis());
    }

    int sweep() {
        try {
            return contextProtocol.sweepExpired();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule
            log.error("Context sweep failed", e);
            return 0;
        }
    }

    @PreDestroy
    void stop() {
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Context sweeper stopped");
    }
}
