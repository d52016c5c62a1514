package com.agentmesh.core.llm;

import java.util.Optional;

/**
 * Optional text-generation backend used by worker agents.
 * <p>
 * An empty result means "no answer available" and is a normal condition callers fall back
 * from. Implementations never throw for backend failures.
 */
public interface ReasoningClient {

    Optional<String> generate(String prompt, String systemPrompt);

    /** Whether a backend is configured at all. */
    boolean isAvailable();
}
