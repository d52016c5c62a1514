package com.agentmesh.core.agent;

import com.agentmesh.config.AgentMeshProperties;
import com.agentmesh.core.learning.PolicyGradientEngine;
import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.memory.MemoryManager;
import com.agentmesh.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GeneralAgentTest {

    private ReasoningClient reasoning;
    private MemoryManager memory;
    private PolicyGradientEngine stylePolicy;
    private GeneralAgent agent;

    @BeforeEach
    void setUp() {
        reasoning = mock(ReasoningClient.class);
        memory = new MemoryManager();
        stylePolicy = new PolicyGradientEngine(new AgentMeshProperties.PolicyGradient(), new Random(11));
        agent = new GeneralAgent("general-1", reasoning, memory, stylePolicy);
    }

    @Test
    @DisplayName("answers through the backend in the sampled style")
    void reasoningAnswer() {
        when(reasoning.generate(anyString(), anyString())).thenReturn(Optional.of("Use a bounded queue."));
        var task = Task.of("How should I buffer events?");

        var result = agent.processTask(task);

        assertTrue(result.success());
        assertEquals(GeneralAgent.REASONING_QUALITY, result.qualityScore(), 1e-9);
        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.payload();
        assertEquals("Use a bounded queue.", payload.get("response"));
        assertTrue(GeneralAgent.STYLES.contains(payload.get("style")));
        assertEquals("Use a bounded queue.", memory.retrieve(task.id()).orElseThrow().value());
    }

    @Test
    @DisplayName("without a backend the task is acknowledged and the policy still learns")
    void acknowledgement() {
        when(reasoning.generate(anyString(), anyString())).thenReturn(Optional.empty());
        var task = Task.of("Tidy up the release notes\nfor 2.1");

        var result = agent.processTask(task);

        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.payload();
        assertEquals("Acknowledged: Tidy up the release notes", payload.get("response"));
        assertEquals(GeneralAgent.ACKNOWLEDGEMENT_QUALITY, result.qualityScore(), 1e-9);

        var state = GeneralAgent.shape(task);
        assertEquals(0.05, stylePolicy.baseline(state), 1e-12);
        assertEquals(0, stylePolicy.pendingSteps());
        var probabilities = stylePolicy.probabilities(state);
        assertTrue(probabilities.get(payload.get("style")) > 0.5);
    }

    @Test
    @DisplayName("task shape distinguishes long descriptions and requirements")
    void shape() {
        assertEquals(Map.of("long", false, "has_requirements", true), GeneralAgent.shape(Task.of("Short", "general")));
        var longTask = Task.of("word ".repeat(60));
        assertEquals(true, GeneralAgent.shape(longTask).get("long"));
    }
}
