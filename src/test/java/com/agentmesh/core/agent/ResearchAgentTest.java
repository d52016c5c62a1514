package com.agentmesh.core.agent;

import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.memory.ContextProtocol;
import com.agentmesh.core.memory.ContextScope;
import com.agentmesh.core.memory.HashEmbedder;
import com.agentmesh.core.memory.SemanticMemory;
import com.agentmesh.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResearchAgentTest {

    private ReasoningClient reasoning;
    private SemanticMemory semanticMemory;
    private ContextProtocol contextProtocol;
    private ResearchAgent agent;

    @BeforeEach
    void setUp() {
        reasoning = mock(ReasoningClient.class);
        semanticMemory = new SemanticMemory(new HashEmbedder(64), 50);
        contextProtocol = new ContextProtocol();
        agent = new ResearchAgent("research-1", reasoning, semanticMemory, contextProtocol);
    }

    @Test
    @DisplayName("findings from the reasoning backend are remembered and shared")
    void reasoningFindings() {
        when(reasoning.generate(anyString(), anyString())).thenReturn(Optional.of("Raft elects a single leader."));
        var task = Task.of("How does Raft handle leader election?", List.of(), 5, Map.of("focus_area", "consensus"));

        var result = agent.processTask(task);

        assertTrue(result.success());
        assertEquals(0.85, result.qualityScore(), 1e-9);
        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.payload();
        assertEquals("reasoning", payload.get("source"));
        assertEquals(1, semanticMemory.size());

        var shared = contextProtocol.get((String) payload.get("contextId")).orElseThrow();
        assertEquals(ContextScope.SHARED, shared.scope());
        assertTrue(shared.isVisibleTo("code-1"));
    }

    @Test
    @DisplayName("without a backend, earlier findings are recalled from memory")
    void recallsFromMemory() {
        when(reasoning.generate(anyString(), anyString())).thenReturn(Optional.empty());
        semanticMemory.store("earlier", "Kafka orders messages within a partition", Map.of(), 0.9);

        var result = agent.processTask(Task.of("How does Kafka order messages within a partition"));

        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.payload();
        assertTrue(result.success());
        assertEquals("memory", payload.get("source"));
        assertTrue(((String) payload.get("findings")).contains("Kafka"));
        assertTrue(result.qualityScore() >= 0.4 && result.qualityScore() <= 0.8);
    }

    @Test
    @DisplayName("with no source at all the result still succeeds at low quality")
    void noSources() {
        when(reasoning.generate(anyString(), anyString())).thenReturn(Optional.empty());

        var result = agent.processTask(Task.of("Survey recent papers on CRDTs\nand summarise"));

        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.payload();
        assertTrue(result.success());
        assertEquals(0.3, result.qualityScore(), 1e-9);
        assertEquals("none", payload.get("source"));
        assertEquals("No sources available for: Survey recent papers on CRDTs", payload.get("findings"));
        assertEquals(0, semanticMemory.size());
    }
}
