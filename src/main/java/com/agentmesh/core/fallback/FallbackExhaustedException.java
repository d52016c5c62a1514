package com.agentmesh.core.fallback;

import java.util.List;

/**
 * Thrown when the primary operation and every fallback option failed. The cause is the last
 * underlying failure.
 */
public class FallbackExhaustedException extends RuntimeException {

    private final String chainName;
    private final List<String> attemptedOptions;

    public FallbackExhaustedException(String chainName, List<String> attemptedOptions, Throwable lastCause) {
        super(buildMessage(chainName, attemptedOptions, lastCause), lastCause);
        this.chainName = chainName;
        this.attemptedOptions = List.copyOf(attemptedOptions);
    }

    private static String buildMessage(String chainName, List<String> attempted, Throwable lastCause) {
        return "All fallback options for chain '" + chainName + "' failed " + attempted
                + (lastCause != null ? "; last cause: " + lastCause.getMessage() : "");
    }

    public String chainName() {
        return chainName;
    }

    public List<String> attemptedOptions() {
        return attemptedOptions;
    }
}
