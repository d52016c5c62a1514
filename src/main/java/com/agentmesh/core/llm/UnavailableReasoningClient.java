package com.agentmesh.core.llm;

import java.util.Optional;

/**
 * Used when no chat model is configured. Always answers empty.
 */
public class UnavailableReasoningClient implements ReasoningClient {

    @Override
    public Optional<String> generate(String prompt, String systemPrompt) {
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
