package com.agentmesh.core.agent;

import com.agentmesh.core.learning.PolicyGradientEngine;
import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.memory.MemoryManager;
import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Catch-all worker for tasks no specialist claims. Answers through the reasoning backend or,
 * without one, acknowledges the task; either way the outcome is kept in short-term memory.
 * <p>
 * The answer style is sampled from a policy over the task's shape and reinforced with the
 * quality it produced.
 */
public final class GeneralAgent implements WorkerAgent {

    static final double REASONING_QUALITY = 0.75;
    static final double ACKNOWLEDGEMENT_QUALITY = 0.5;

    static final List<String> STYLES = List.of("concise", "detailed");

    private static final Map<String, String> SYSTEM_PROMPTS = Map.of(
            "concise", "You are a helpful generalist agent. Answer briefly.",
            "detailed", "You are a helpful generalist agent. Answer step by step and cover edge cases.");

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("general", "General-purpose task handling", 0.6),
            new AgentCapability("document", "Write documentation and summaries", 0.6),
            new AgentCapability("research", "Basic information lookup", 0.3),
            new AgentCapability("analyze", "Basic reasoning about a problem", 0.3));

    private final String agentId;
    private final ReasoningClient reasoningClient;
    private final MemoryManager memory;
    private final PolicyGradientEngine stylePolicy;

    public GeneralAgent(String agentId, ReasoningClient reasoningClient, MemoryManager memory,
                        PolicyGradientEngine stylePolicy) {
        this.agentId = agentId;
        this.reasoningClient = reasoningClient;
        this.memory = memory;
        this.stylePolicy = stylePolicy;
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
        Map<String, Object> state = shape(task);
        String style = stylePolicy.selectAction(state, STYLES);

        var answer = reasoningClient.generate(task.description(), SYSTEM_PROMPTS.get(style));
        String response = answer.orElseGet(() -> "Acknowledged: "
                + task.description().lines().findFirst().orElse("").strip());
        double quality = answer.isPresent() ? REASONING_QUALITY : ACKNOWLEDGEMENT_QUALITY;

        stylePolicy.recordStep(state, style, quality);
        stylePolicy.endEpisode();
        memory.storeShortTerm(task.id(), response, quality);
        return Result.success(task.id(), agentId, Map.of("response", response, "style", style),
                Duration.ofNanos(System.nanoTime() - start), quality);
    }

    static Map<String, Object> shape(Task task) {
        return Map.of(
                "long", task.descriptionWords().size() > 50,
                "has_requirements", !task.requirements().isEmpty());
    }
}
