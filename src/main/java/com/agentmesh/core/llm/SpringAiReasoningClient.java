package com.agentmesh.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Optional;

/**
 * {@link ReasoningClient} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Blank responses and any exception raised by the model call are reported as
 * {@link Optional#empty()}.
 */
public class SpringAiReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiReasoningClient.class);

    private final ChatClient chatClient;

    public SpringAiReasoningClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Optional<String> generate(String prompt, String systemPrompt) {
        long start = System.currentTimeMillis();
        try {
            var request = chatClient.prompt().user(prompt);
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                request = request.system(systemPrompt);
            }
            String response = request.call().content();
            long elapsed = System.currentTimeMillis() - start;
            if (response == null || response.isBlank()) {
                log.warn("Model returned empty content after {}ms", elapsed);
                return Optional.empty();
            }
            log.debug("Model call complete ({}ms, {} chars)", elapsed, response.length());
            return Optional.of(response);
        } catch (Exception e) {
            log.warn("Model call failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
            log.debug("Model call failure", e);
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
