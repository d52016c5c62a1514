package com.agentmesh.core.fallback;

/**
 * One way of producing a result from the chain's arguments. Any exception counts as a failure.
 */
@FunctionalInterface
public interface FallbackHandler<T, R> {
    R handle(T args) throws Exception;
}
