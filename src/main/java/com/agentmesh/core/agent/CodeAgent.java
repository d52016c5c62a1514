package com.agentmesh.core.agent;

import com.agentmesh.core.fallback.FallbackChain;
import com.agentmesh.core.fallback.FallbackExhaustedException;
import com.agentmesh.core.fallback.FallbackRegistry;
import com.agentmesh.core.fallback.FallbackStrategy;
import com.agentmesh.core.learning.Experience;
import com.agentmesh.core.learning.QLearningEngine;
import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.AgentUnavailableException;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Produces code for a task. The approach (generate, refactor or debug) is chosen by a Q-learning
 * engine from simple task features and rewarded with the quality of the outcome. Code comes from
 * the reasoning backend, falling back to a skeleton template through the agent's fallback chain.
 */
public final class CodeAgent implements WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(CodeAgent.class);

    static final List<String> APPROACHES = List.of("generate", "refactor", "debug");

    static final double REASONING_QUALITY = 0.85;
    static final double TEMPLATE_QUALITY = 0.5;

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("code", "Write and change source code", 0.9),
            new AgentCapability("debug", "Locate and fix defects", 0.8),
            new AgentCapability("refactor", "Restructure existing code", 0.7),
            new AgentCapability("test", "Write tests alongside code", 0.3));

    private record CodeRequest(Task task, String approach) {}

    private record Generated(String code, String source, double quality) {}

    private final String agentId;
    private final ReasoningClient reasoningClient;
    private final QLearningEngine approachLearner;
    private final FallbackChain<CodeRequest, Generated> generation;

    public CodeAgent(String agentId, ReasoningClient reasoningClient, QLearningEngine approachLearner,
                     FallbackRegistry fallbackRegistry) {
        this.agentId = agentId;
        this.reasoningClient = reasoningClient;
        this.approachLearner = approachLearner;
        this.generation = fallbackRegistry.register(agentId + ".generation", FallbackStrategy.SEQUENTIAL);
        if (generation.options().isEmpty()) {
            generation.addFallback("template", CodeAgent::fromTemplate, 1);
        }
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public List<AgentCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Result processTask(Task task) {
        long start = System.nanoTime();
        Map<String, Object> state = features(task);
        String approach = approachLearner.selectAction(state, APPROACHES);
        log.debug("Task {}: chose approach {} for state {}", task.id(), approach, state);

        Generated generated;
        try {
            generated = generation.execute(this::fromReasoning, new CodeRequest(task, approach));
        } catch (FallbackExhaustedException e) {
            learn(state, approach, 0.0);
            return Result.failure(task.id(), agentId, "Code generation failed: " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - start));
        }

        learn(state, approach, generated.quality());
        var payload = Map.of(
                "approach", approach,
                "code", generated.code(),
                "source", generated.source());
        return Result.success(task.id(), agentId, payload, Duration.ofNanos(System.nanoTime() - start),
                generated.quality());
    }

    private void learn(Map<String, Object> state, String approach, double reward) {
        var experience = Experience.terminal(state, approach, reward);
        approachLearner.update(experience);
        approachLearner.remember(experience);
        approachLearner.endEpisode();
    }

    static Map<String, Object> features(Task task) {
        String text = task.description().toLowerCase(Locale.ROOT);
        return Map.of(
                "mentions_bug", text.contains("bug") || text.contains("fix") || text.contains("error"),
                "mentions_refactor", text.contains("refactor") || text.contains("clean up"),
                "has_code", task.context().containsKey("code"),
                "requirements", task.requirements().size());
    }

    private Generated fromReasoning(CodeRequest request) {
        String prompt = "Approach: " + request.approach() + "\n\n" + request.task().description()
                + (request.task().context().containsKey("code")
                    ? "\n\nExisting code:\n" + request.task().context().get("code") : "");
        String code = reasoningClient.generate(prompt, "You are a senior software engineer. Reply with code only.")
                .orElseThrow(() -> new AgentUnavailableException("Reasoning backend returned no code"));
        return new Generated(code, "reasoning", REASONING_QUALITY);
    }

    private static Generated fromTemplate(CodeRequest request) {
        String summary = request.task().description().lines().findFirst().orElse("task").strip();
        String code = switch (request.approach()) {
            case "debug" -> "// Reproduce, then fix: " + summary + "\n// 1. failing test\n// 2. minimal fix\n";
            case "refactor" -> "// Refactor plan: " + summary + "\n// keep behaviour, extract and rename\n";
            default -> "// Implementation skeleton: " + summary + "\npublic final class Solution {\n}\n";
        };
        return new Generated(code, "template", TEMPLATE_QUALITY);
    }
}
