package com.agentmesh.core.memory;

import java.util.Map;

/**
 * One retrieval hit from {@link SemanticMemory}.
 */
public record SemanticMatch(
    String key,
    String content,
    Map<String, Object> context,
    double importance,
    int accessCount,
    double score
) {}
