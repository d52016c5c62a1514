package com.agentmesh.core.agent;

import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.memory.ContextProtocol;
import com.agentmesh.core.memory.ContextScope;
import com.agentmesh.core.memory.ContextType;
import com.agentmesh.core.memory.SemanticMatch;
import com.agentmesh.core.memory.SemanticMemory;
import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gathers findings for a question from the reasoning backend, or from earlier findings kept in
 * semantic memory when the backend has no answer. New findings are remembered and shared with
 * the other agents as context.
 */
public final class ResearchAgent implements WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(ResearchAgent.class);

    static final String SYSTEM_PROMPT = """
            You are a research specialist in a team of agents. Answer with concise, factual findings.
            Mark anything uncertain as such and name the basis for each finding.
            """;

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("research", "Gather and summarise information", 0.9),
            new AgentCapability("analyze", "Interpret gathered information", 0.5),
            new AgentCapability("document", "Write up findings", 0.5));

    private final String agentId;
    private final ReasoningClient reasoningClient;
    private final SemanticMemory semanticMemory;
    private final ContextProtocol contextProtocol;

    public ResearchAgent(String agentId, ReasoningClient reasoningClient, SemanticMemory semanticMemory,
                         ContextProtocol contextProtocol) {
        this.agentId = agentId;
        this.reasoningClient = reasoningClient;
        this.semanticMemory = semanticMemory;
        this.contextProtocol = contextProtocol;
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
        String findings;
        String source;
        double quality;

        var answer = reasoningClient.generate(task.description(), SYSTEM_PROMPT);
        if (answer.isPresent()) {
            findings = answer.get();
            source = "reasoning";
            quality = 0.85;
        } else {
            List<SemanticMatch> recalled = semanticMemory.retrieve(task.description(), focusOf(task), 3);
            if (!recalled.isEmpty()) {
                findings = recalled.stream().map(SemanticMatch::content).collect(Collectors.joining("\n"));
                source = "memory";
                quality = Math.min(0.8, 0.4 + 0.4 * Math.max(0.0, recalled.get(0).score()));
            } else {
                findings = "No sources available for: " + firstLine(task.description());
                source = "none";
                quality = 0.3;
            }
            log.debug("Reasoning unavailable for {}, used {} ({} recalled)", task.id(), source, recalled.size());
        }

        if (!"none".equals(source)) {
            semanticMemory.store(task.id(), findings, focusOf(task), quality);
        }
        var shared = contextProtocol.store(agentId, ContextType.RESULT, ContextScope.SHARED,
                findings, quality, Duration.ZERO);

        var payload = new HashMap<String, Object>();
        payload.put("findings", findings);
        payload.put("source", source);
        payload.put("contextId", shared.id());
        return Result.success(task.id(), agentId, payload, Duration.ofNanos(System.nanoTime() - start), quality);
    }

    private static Map<String, Object> focusOf(Task task) {
        Object focus = task.context().get("focus_area");
        return focus != null ? Map.of("focus_area", focus) : Map.of();
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl >= 0 ? text.substring(0, nl) : text;
    }
}
