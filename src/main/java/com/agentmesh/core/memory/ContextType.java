package com.agentmesh.core.memory;

public enum ContextType {
    FACT,
    OBSERVATION,
    DECISION,
    RESULT,
    INSTRUCTION
}
