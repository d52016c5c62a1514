package com.agentmesh.core.fallback;

import com.agentmesh.core.metrics.AgentMeshMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps a primary operation with alternative handlers that take over when it fails.
 * <p>
 * Options are kept sorted by priority, highest first. Every completed attempt on an option
 * updates its success or failure counter and its average latency, whatever the strategy. Under
 * {@link FallbackStrategy#ADAPTIVE} this also charges failures to higher-ranked options tried
 * before a working one, which lowers their score even when the chain as a whole is healthy.
 *
 * @param <T> argument type passed to every handler
 * @param <R> result type
 */
public class FallbackChain<T, R> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private static final Comparator<FallbackOption<?, ?>> BY_PRIORITY =
            Comparator.comparingInt((FallbackOption<?, ?> o) -> o.priority()).reversed();

    private final String name;
    private final FallbackStrategy strategy;
    private final ExecutorService parallelExecutor;
    private final Random random;
    private final AgentMeshMetrics metrics;

    private volatile List<FallbackOption<T, R>> options = List.of();

    private final AtomicLong primarySuccesses = new AtomicLong();
    private final AtomicLong primaryFailures = new AtomicLong();
    private final AtomicLong exhaustions = new AtomicLong();

    public FallbackChain(String name, FallbackStrategy strategy, ExecutorService parallelExecutor,
                         Random random, AgentMeshMetrics metrics) {
        this.name = name;
        this.strategy = strategy;
        this.parallelExecutor = parallelExecutor;
        this.random = random != null ? random : new Random();
        this.metrics = metrics;
        if (strategy == FallbackStrategy.PARALLEL && parallelExecutor == null) {
            throw new IllegalArgumentException("Parallel strategy needs an executor");
        }
    }

    public String name() {
        return name;
    }

    public FallbackStrategy strategy() {
        return strategy;
    }

    /**
     * Registers an alternative handler. Options with equal priority keep registration order.
     */
    public synchronized FallbackChain<T, R> addFallback(String optionName, FallbackHandler<T, R> handler,
                                                        int priority, double weight) {
        var updated = new ArrayList<>(options);
        updated.add(new FallbackOption<>(optionName, handler, priority, weight));
        updated.sort(BY_PRIORITY);
        options = List.copyOf(updated);
        log.debug("Chain {}: added fallback {} (priority {}, weight {})", name, optionName, priority, weight);
        return this;
    }

    public FallbackChain<T, R> addFallback(String optionName, FallbackHandler<T, R> handler, int priority) {
        return addFallback(optionName, handler, priority, 1.0);
    }

    /** Options in priority order. */
    public List<FallbackOption<T, R>> options() {
        return options;
    }

    /**
     * Runs {@code primary}; if it throws, hands over to the chain's strategy.
     *
     * @throws FallbackExhaustedException if the primary and every option failed
     */
    public R execute(FallbackHandler<T, R> primary, T args) {
        Exception primaryError;
        try {
            R result = primary.handle(args);
            primarySuccesses.incrementAndGet();
            return result;
        } catch (Exception e) {
            primaryFailures.incrementAndGet();
            primaryError = e;
            log.warn("Chain {}: primary failed ({}), falling back with {} strategy",
                    name, e.getMessage(), strategy);
        }

        List<FallbackOption<T, R>> snapshot = options;
        if (snapshot.isEmpty()) {
            throw exhausted(List.of(), primaryError);
        }
        return switch (strategy) {
            case SEQUENTIAL -> runSequential(snapshot, args, new ArrayList<>(), primaryError);
            case PARALLEL -> runParallel(snapshot, args, primaryError);
            case WEIGHTED -> runWeighted(snapshot, args, primaryError);
            case ADAPTIVE -> runSequential(rankAdaptively(snapshot), args, new ArrayList<>(), primaryError);
        };
    }

    /** Runs the fallback options directly, as if the primary had failed. */
    public R executeFallbacks(T args) {
        return execute(a -> {
            throw new IllegalStateException("no primary");
        }, args);
    }

    private R runSequential(List<FallbackOption<T, R>> ordered, T args, List<String> attempted,
                            Throwable lastCause) {
        Throwable cause = lastCause;
        for (FallbackOption<T, R> option : ordered) {
            attempted.add(option.name());
            try {
                R result = attempt(option, args);
                log.info("Chain {}: fallback {} succeeded", name, option.name());
                return result;
            } catch (Exception e) {
                cause = e;
                log.warn("Chain {}: fallback {} failed: {}", name, option.name(), e.getMessage());
            }
        }
        throw exhausted(attempted, cause);
    }

    private R runWeighted(List<FallbackOption<T, R>> ordered, T args, Throwable primaryError) {
        FallbackOption<T, R> chosen = drawByWeight(ordered);
        var attempted = new ArrayList<String>();
        attempted.add(chosen.name());
        try {
            R result = attempt(chosen, args);
            log.info("Chain {}: weighted pick {} succeeded", name, chosen.name());
            return result;
        } catch (Exception e) {
            log.warn("Chain {}: weighted pick {} failed ({}), trying remaining options in order",
                    name, chosen.name(), e.getMessage());
            var remainder = new ArrayList<>(ordered);
            remainder.remove(chosen);
            return runSequential(remainder, args, attempted, e);
        }
    }

    private FallbackOption<T, R> drawByWeight(List<FallbackOption<T, R>> ordered) {
        double total = ordered.stream().mapToDouble(FallbackOption::weight).sum();
        if (total <= 0) {
            return ordered.get(0);
        }
        double draw = random.nextDouble() * total;
        double cumulative = 0;
        for (FallbackOption<T, R> option : ordered) {
            cumulative += option.weight();
            if (draw < cumulative) {
                return option;
            }
        }
        return ordered.get(ordered.size() - 1);
    }

    private List<FallbackOption<T, R>> rankAdaptively(List<FallbackOption<T, R>> ordered) {
        var scores = new HashMap<FallbackOption<T, R>, Double>();
        for (FallbackOption<T, R> option : ordered) {
            scores.put(option, option.adaptiveScore());
        }
        var ranked = new ArrayList<>(ordered);
        ranked.sort(Comparator.comparingDouble((FallbackOption<T, R> o) -> scores.get(o)).reversed());
        return ranked;
    }

    private R runParallel(List<FallbackOption<T, R>> ordered, T args, Throwable primaryError) {
        CompletionService<R> completion = new ExecutorCompletionService<>(parallelExecutor);
        AtomicBoolean settled = new AtomicBoolean(false);
        Map<Future<R>, FallbackOption<T, R>> running = new HashMap<>();
        for (FallbackOption<T, R> option : ordered) {
            running.put(completion.submit(() -> attemptUnlessSettled(option, args, settled)), option);
        }

        var attempted = new ArrayList<String>();
        Throwable cause = primaryError;
        try {
            for (int i = 0; i < ordered.size(); i++) {
                Future<R> done = completion.take();
                FallbackOption<T, R> option = running.remove(done);
                attempted.add(option.name());
                try {
                    R result = done.get();
                    running.keySet().forEach(f -> f.cancel(true));
                    log.info("Chain {}: parallel fallback {} won, cancelled {} other(s)",
                            name, option.name(), running.size());
                    return result;
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof Superseded) {
                        attempted.remove(attempted.size() - 1);
                        continue;
                    }
                    cause = e.getCause();
                    log.warn("Chain {}: parallel fallback {} failed: {}", name, option.name(), cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.keySet().forEach(f -> f.cancel(true));
            cause = e;
        }
        throw exhausted(attempted, cause);
    }

    /** Thrown by a parallel branch that succeeded after another branch had already won. */
    private static final class Superseded extends Exception {
        Superseded(String option) {
            super(option, null, false, false);
        }
    }

    /**
     * Runs one parallel branch. Only the first successful branch claims the win and records a
     * success; later successes surface as {@link Superseded} and leave their statistics alone.
     */
    private R attemptUnlessSettled(FallbackOption<T, R> option, T args, AtomicBoolean settled) throws Exception {
        long start = System.nanoTime();
        R result;
        try {
            result = option.handler().handle(args);
        } catch (Exception e) {
            if (!settled.get()) {
                option.recordFailure(Duration.ofNanos(System.nanoTime() - start));
            }
            throw e;
        }
        if (!settled.compareAndSet(false, true)) {
            throw new Superseded(option.name());
        }
        option.recordSuccess(Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    private R attempt(FallbackOption<T, R> option, T args) throws Exception {
        long start = System.nanoTime();
        try {
            R result = option.handler().handle(args);
            option.recordSuccess(Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (Exception e) {
            option.recordFailure(Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }

    private FallbackExhaustedException exhausted(List<String> attempted, Throwable cause) {
        exhaustions.incrementAndGet();
        if (metrics != null) {
            metrics.recordFallbackExhausted(name);
        }
        log.error("Chain {}: all fallbacks exhausted after {}", name, attempted);
        return new FallbackExhaustedException(name, attempted, cause);
    }

    public ChainStatistics statistics() {
        return new ChainStatistics(name, strategy, primarySuccesses.get(), primaryFailures.get(),
                exhaustions.get(), options.stream().map(FallbackOption::statistics).toList());
    }

    /**
     * Point-in-time view of a chain's counters.
     */
    public record ChainStatistics(
        String name,
        FallbackStrategy strategy,
        long primarySuccesses,
        long primaryFailures,
        long exhaustions,
        List<FallbackOption.OptionStatistics> options
    ) {}
}
