package com.agentmesh.core.fallback;

import com.agentmesh.core.metrics.AgentMeshMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Named fallback chains shared by everything that receives this registry.
 * <p>
 * Chains must be registered once before use. Registering an existing name returns the chain
 * already there; looking up a name that was never registered is a programming error.
 */
public class FallbackRegistry {

    private static final Logger log = LoggerFactory.getLogger(FallbackRegistry.class);

    private final ConcurrentHashMap<String, FallbackChain<?, ?>> chains = new ConcurrentHashMap<>();
    private final ExecutorService parallelExecutor;
    private final AgentMeshMetrics metrics;
    private final Random random;

    public FallbackRegistry(ExecutorService parallelExecutor, AgentMeshMetrics metrics) {
        this(parallelExecutor, metrics, new Random());
    }

    public FallbackRegistry(ExecutorService parallelExecutor, AgentMeshMetrics metrics, Random random) {
        this.parallelExecutor = parallelExecutor;
        this.metrics = metrics;
        this.random = random;
    }

    /**
     * Creates the chain {@code name}, or returns the existing one unchanged.
     */
    @SuppressWarnings("unchecked")
    public <T, R> FallbackChain<T, R> register(String name, FallbackStrategy strategy) {
        FallbackChain<?, ?> chain = chains.computeIfAbsent(name, n -> {
            log.info("Registered fallback chain {} ({})", n, strategy);
            return new FallbackChain<>(n, strategy, parallelExecutor, random, metrics);
        });
        if (chain.strategy() != strategy) {
            log.debug("Chain {} already registered with {}; ignoring requested {}",
                    name, chain.strategy(), strategy);
        }
        return (FallbackChain<T, R>) chain;
    }

    /**
     * @throws UnknownChainException if {@code name} was never registered
     */
    @SuppressWarnings("unchecked")
    public <T, R> FallbackChain<T, R> chain(String name) {
        FallbackChain<?, ?> chain = chains.get(name);
        if (chain == null) {
            throw new UnknownChainException(name);
        }
        return (FallbackChain<T, R>) chain;
    }

    public boolean contains(String name) {
        return chains.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(chains.keySet());
    }

    public boolean remove(String name) {
        return chains.remove(name) != null;
    }
}
